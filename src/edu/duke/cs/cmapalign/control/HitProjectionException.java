/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.duke.cs.cmapalign.control;

import edu.duke.cs.cmapalign.search.SearchHit;

/**
 *
 * A hit's projection failed and the batch was set to abort on failure
 * The original problem is the cause
 *
 * @author mhall44
 */
@SuppressWarnings("serial")
public class HitProjectionException extends RuntimeException {

    String hitId;

    public HitProjectionException(SearchHit hit, Throwable cause){
        super("ERROR: projection failed for hit "+hit.getHitId()+": "+cause.getMessage(), cause);
        hitId = hit.getHitId();
    }

    public String getHitId(){
        return hitId;
    }
}
