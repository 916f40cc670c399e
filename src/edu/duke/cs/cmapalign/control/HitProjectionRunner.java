/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.duke.cs.cmapalign.control;

import edu.duke.cs.cmapalign.align.ContactMapProjector;
import edu.duke.cs.cmapalign.align.ProjectedContactMap;
import edu.duke.cs.cmapalign.contacts.ContactMapBuilder;
import edu.duke.cs.cmapalign.contacts.EmptyStructureException;
import edu.duke.cs.cmapalign.contacts.SparseContactGraph;
import edu.duke.cs.cmapalign.search.SearchHit;
import edu.duke.cs.cmapalign.structure.ResidueCoords;
import edu.duke.cs.cmapalign.structure.StructureSource;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 *
 * Projects template contact maps onto queries for a batch of search hits
 * Hits are independent, so each is its own task on a fixed thread pool
 * A hit that fails (missing/empty structure, bad alignment...) is recorded and skipped
 * unless abortOnFailure is set.  Nothing is retried
 *
 * @author mhall44
 */
public class HitProjectionRunner {

    ContactMapSettings settings;
    StructureSource structures;

    ContactMapBuilder builder;
    ContactMapProjector projector;

    private final Object retrievalLock = new Object();//for structure sources that can't take concurrent reads


    public HitProjectionRunner(ContactMapSettings settings, StructureSource structures){
        settings.validate();
        this.settings = settings;
        this.structures = structures;
        builder = new ContactMapBuilder(settings);
        projector = new ContactMapProjector(settings.generatedContacts);
    }


    public HitProjection projectHit(SearchHit hit) throws IOException {
        String structureId = hit.getStructureId();
        ResidueCoords coords = fetchStructure(structureId);
        if(coords.isEmpty())
            throw new EmptyStructureException(structureId);

        SparseContactGraph targetContacts = builder.buildSparse(coords);
        ProjectedContactMap cmap = projector.project(hit.getAlignment(), targetContacts);
        return new HitProjection(hit, cmap);
    }


    private ResidueCoords fetchStructure(String structureId) throws IOException {
        if(structures.isThreadSafe())
            return structures.getStructure(structureId);
        synchronized(retrievalLock){
            return structures.getStructure(structureId);
        }
    }


    public ProjectionBatchResult projectAll(List<SearchHit> hits){
        ProjectionBatchResult ans = new ProjectionBatchResult();

        if(settings.numThreads==1){
            for(SearchHit hit : hits){
                try {
                    ans.projections.add(projectHit(hit));
                }
                catch(IOException | RuntimeException e){
                    recordFailure(ans, hit, e);
                }
            }
            return ans;
        }

        ExecutorService pool = Executors.newFixedThreadPool(settings.numThreads);
        try {
            ArrayList<Future<HitProjection>> tasks = new ArrayList<>();
            for(SearchHit hit : hits)
                tasks.add(pool.submit(() -> projectHit(hit)));

            for(int h=0; h<hits.size(); h++){
                try {
                    ans.projections.add(tasks.get(h).get());
                }
                catch(ExecutionException e){
                    recordFailure(ans, hits.get(h), e.getCause());
                }
            }
        }
        catch(InterruptedException e){
            Thread.currentThread().interrupt();
            throw new RuntimeException("ERROR: interrupted while projecting contact maps", e);
        }
        finally {
            pool.shutdownNow();
        }

        return ans;
    }


    private void recordFailure(ProjectionBatchResult batch, SearchHit hit, Throwable cause){
        if(settings.abortOnFailure){
            System.err.println("Projection failed for hit "+hit.getHitId()+"; aborting");
            if(cause instanceof Error)
                throw (Error)cause;
            throw new HitProjectionException(hit, cause);
        }

        System.err.println("Skipping hit "+hit.getHitId()+": "+cause.getMessage());
        batch.failures.add(new HitFailure(hit, cause));
    }
}
