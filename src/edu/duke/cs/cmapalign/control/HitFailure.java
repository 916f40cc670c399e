/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.duke.cs.cmapalign.control;

import edu.duke.cs.cmapalign.search.SearchHit;

/**
 *
 * @author mhall44
 */
public class HitFailure {

    SearchHit hit;
    Throwable cause;

    public HitFailure(SearchHit hit, Throwable cause){
        this.hit = hit;
        this.cause = cause;
    }

    public SearchHit getHit(){
        return hit;
    }

    public String getHitId(){
        return hit.getHitId();
    }

    public Throwable getCause(){
        return cause;
    }

    @Override
    public String toString(){
        return getHitId()+": "+cause.getMessage();
    }
}
