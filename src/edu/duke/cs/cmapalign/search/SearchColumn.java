/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.duke.cs.cmapalign.search;

/**
 *
 * Columns of a homology search result table, in the order we write them
 * Names match the search tool's tabular output headers
 *
 * @author mhall44
 */
public enum SearchColumn {

    QUERY("query"),
    TARGET("target"),
    FIDENT("fident"),//fraction identity
    ALNLEN("alnlen"),
    MISMATCH("mismatch"),
    GAPOPEN("gapopen"),
    QSTART("qstart"),
    QEND("qend"),
    TSTART("tstart"),
    TEND("tend"),
    QCOV("qcov"),
    TCOV("tcov"),
    EVALUE("evalue"),
    BITS("bits"),
    QALN("qaln"),//gapped query
    TALN("taln");//gapped target

    private final String header;

    SearchColumn(String header){
        this.header = header;
    }

    public String getHeader(){
        return header;
    }

    public static SearchColumn fromHeader(String header){
        //null if not a column we know
        for(SearchColumn col : values()){
            if(col.header.equalsIgnoreCase(header.trim()))
                return col;
        }
        return null;
    }
}
