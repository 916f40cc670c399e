/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.duke.cs.cmapalign.control;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 *
 * Successful projections and failed hits from one batch, each in input order
 *
 * @author mhall44
 */
public class ProjectionBatchResult {

    ArrayList<HitProjection> projections = new ArrayList<>();
    ArrayList<HitFailure> failures = new ArrayList<>();

    public List<HitProjection> getProjections(){
        return Collections.unmodifiableList(projections);
    }

    public List<HitFailure> getFailures(){
        return Collections.unmodifiableList(failures);
    }

    public int getNumHits(){
        return projections.size()+failures.size();
    }

    public boolean allSucceeded(){
        return failures.isEmpty();
    }
}
