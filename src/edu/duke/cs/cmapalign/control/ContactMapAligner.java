/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.duke.cs.cmapalign.control;

import edu.duke.cs.cmapalign.search.SearchResultTable;
import edu.duke.cs.cmapalign.structure.PDBDirectoryStructureSource;
import java.io.File;
import java.io.IOException;

/**
 *
 * Command-line driver: read search hits, project template contact maps onto the queries,
 * report what we got
 *
 * Usage: ContactMapAligner -c config.cfg [more config files...]
 * Later config files override earlier ones, and all override defaults.cfg
 *
 * @author mhall44
 */
public class ContactMapAligner {

    ParamSet params;
    ContactMapSettings settings;


    public ContactMapAligner(String[] args){
        if(args.length<2 || !args[0].equalsIgnoreCase("-c"))
            throw new ConfigurationException("ERROR: usage: ContactMapAligner -c config.cfg [more config files...]");

        params = ParamSet.withDefaults();
        for(int a=1; a<args.length; a++)
            params.addParamsFromFile(args[a]);
        settings = new ContactMapSettings(params);
    }


    public static void main(String[] args) throws IOException {
        new ContactMapAligner(args).run();
    }


    public ProjectionBatchResult run() throws IOException {
        File searchResults = params.getFile("SEARCHRESULTS");
        File structureDir = params.getFile("STRUCTUREDIR");

        SearchResultTable hits = SearchResultTable.readTSV(searchResults);
        System.out.println("Read "+hits.size()+" hits for "+hits.getQueries().size()+" queries from "+searchResults);

        hits = hits.filter( params.getDouble("MINIDENTITY", Double.NaN), params.getDouble("MINBITSCORE", Double.NaN) );
        int topHits = params.getInt("TOPHITS", 0);
        if(topHits>0)
            hits = hits.topHitsPerQuery(topHits);
        System.out.println(hits.size()+" hits after filtering");

        HitProjectionRunner runner = new HitProjectionRunner(settings, new PDBDirectoryStructureSource(structureDir));
        long startTime = System.currentTimeMillis();
        ProjectionBatchResult result = runner.projectAll(hits.getHits());
        long elapsed = System.currentTimeMillis() - startTime;

        for(HitProjection proj : result.getProjections()){
            System.out.println("PROJECTED "+proj.getHit().getHitId()+" query residues: "
                    +proj.getContactMap().getNumRes()+" contacts: "+proj.getContactMap().countContacts());
        }
        System.out.println("Projected "+result.getProjections().size()+" contact maps in "+elapsed+" ms; "
                +result.getFailures().size()+" hits failed");

        return result;
    }
}
