/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.duke.cs.cmapalign.search;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileReader;
import java.io.FileWriter;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;

/**
 *
 * Hits from a homology search of query sequences against a template database,
 * plus where they came from (query file, database)
 *
 * Tab-separated format: optional "#Query:" and "#Database:" comment lines,
 * a header row of column names, then one hit per row
 *
 * @author mhall44
 */
public class SearchResultTable {

    static final String QUERY_COMMENT = "#Query:";
    static final String DATABASE_COMMENT = "#Database:";

    ArrayList<SearchHit> hits;
    String queryFile;//may be null
    String database;//may be null


    public SearchResultTable(List<SearchHit> hits, String queryFile, String database){
        this.hits = new ArrayList<>(hits);
        this.queryFile = queryFile;
        this.database = database;
    }


    public static SearchResultTable readTSV(File f) throws IOException {
        String queryFile = null;
        String database = null;
        ArrayList<SearchHit> hits = new ArrayList<>();
        SearchColumn[] columns = null;//by position in the file; null entries are ignored columns

        try(BufferedReader br = new BufferedReader(new FileReader(f, StandardCharsets.UTF_8))){
            String line;
            int lineNum = 0;
            while( (line=br.readLine()) != null ){
                lineNum++;
                if(line.isBlank())
                    continue;

                if(line.startsWith(QUERY_COMMENT))
                    queryFile = emptyToNull(line.substring(QUERY_COMMENT.length()));
                else if(line.startsWith(DATABASE_COMMENT))
                    database = emptyToNull(line.substring(DATABASE_COMMENT.length()));
                else if(line.startsWith("#"))
                    continue;
                else if(columns==null)
                    columns = parseHeader(line, f);
                else
                    hits.add(parseHit(line, columns, lineNum, f));
            }
        }

        if(columns==null)
            throw new IOException("No header row in search results "+f);

        return new SearchResultTable(hits, queryFile, database);
    }


    private static String emptyToNull(String s){
        s = s.trim();
        return s.isEmpty() ? null : s;
    }


    private static SearchColumn[] parseHeader(String line, File f) throws IOException {
        String[] headers = line.split("\t");
        SearchColumn[] ans = new SearchColumn[headers.length];
        boolean hasQuery = false, hasTarget = false;
        for(int c=0; c<headers.length; c++){
            ans[c] = SearchColumn.fromHeader(headers[c]);
            if(ans[c]==null)
                System.out.println("WARNING: ignoring unrecognized column "+headers[c]+" in "+f);
            else if(ans[c]==SearchColumn.QUERY)
                hasQuery = true;
            else if(ans[c]==SearchColumn.TARGET)
                hasTarget = true;
        }
        if( ! (hasQuery && hasTarget) )
            throw new IOException("Search results "+f+" need query and target columns");
        return ans;
    }


    private static SearchHit parseHit(String line, SearchColumn[] columns, int lineNum, File f) throws IOException {
        String[] vals = line.split("\t", -1);
        if(vals.length!=columns.length)
            throw new IOException("Line "+lineNum+" of "+f+" has "+vals.length
                    +" fields but the header has "+columns.length);

        SearchHit hit = new SearchHit(null, null);
        for(int c=0; c<columns.length; c++){
            if(columns[c]==null)
                continue;
            try {
                hit.setValue(columns[c], vals[c].trim());
            }
            catch(RuntimeException e){
                throw new IOException("Line "+lineNum+" of "+f+": "+e.getMessage(), e);
            }
        }
        return hit;
    }


    public void writeTSV(File f) throws IOException {
        try(PrintWriter pw = new PrintWriter(new FileWriter(f, StandardCharsets.UTF_8))){
            pw.println(QUERY_COMMENT+(queryFile==null ? "" : queryFile));
            pw.println(DATABASE_COMMENT+(database==null ? "" : database));

            SearchColumn[] columns = SearchColumn.values();
            StringBuilder header = new StringBuilder();
            for(int c=0; c<columns.length; c++){
                if(c>0)
                    header.append('\t');
                header.append(columns[c].getHeader());
            }
            pw.println(header);

            for(SearchHit hit : hits){
                StringBuilder row = new StringBuilder();
                for(int c=0; c<columns.length; c++){
                    if(c>0)
                        row.append('\t');
                    row.append(hit.getValue(columns[c]));
                }
                pw.println(row);
            }
        }
    }


    public SearchResultTable filter(double minIdentity, double minBitScore){
        //keep hits meeting both thresholds.  NaN threshold = no filter on that
        ArrayList<SearchHit> ans = new ArrayList<>();
        for(SearchHit hit : hits){
            if( !Double.isNaN(minIdentity) && !(hit.fident>=minIdentity) )
                continue;
            if( !Double.isNaN(minBitScore) && !(hit.bits>=minBitScore) )
                continue;
            ans.add(hit);
        }
        return new SearchResultTable(ans, queryFile, database);
    }


    public SearchResultTable topHitsPerQuery(int k){
        //the k best hits for each query: highest identity, then lowest e-value
        //queries stay in order of first appearance
        //identity ties go to the lower e-value (the stronger hit), not the higher one that reversing an ascending sort would pick
        Comparator<SearchHit> quality = Comparator
                .comparingDouble((SearchHit h) -> -nanToWorst(h.fident))
                .thenComparingDouble(h -> Double.isNaN(h.evalue) ? Double.POSITIVE_INFINITY : h.evalue);

        ArrayList<SearchHit> ans = new ArrayList<>();
        for(String query : getQueries()){
            ArrayList<SearchHit> queryHits = new ArrayList<>(hitsForQuery(query));
            queryHits.sort(quality);//stable, so ties keep file order
            ans.addAll(queryHits.subList(0, Math.min(k, queryHits.size())));
        }
        return new SearchResultTable(ans, queryFile, database);
    }

    private static double nanToWorst(double identity){
        return Double.isNaN(identity) ? Double.NEGATIVE_INFINITY : identity;
    }


    public List<String> getQueries(){
        LinkedHashSet<String> ans = new LinkedHashSet<>();
        for(SearchHit hit : hits)
            ans.add(hit.query);
        return new ArrayList<>(ans);
    }

    public List<SearchHit> hitsForQuery(String query){
        ArrayList<SearchHit> ans = new ArrayList<>();
        for(SearchHit hit : hits){
            if(hit.query.equals(query))
                ans.add(hit);
        }
        return ans;
    }

    public List<SearchHit> getHits(){
        return Collections.unmodifiableList(hits);
    }

    public int size(){
        return hits.size();
    }

    public String getQueryFile(){
        return queryFile;
    }

    public String getDatabase(){
        return database;
    }
}
