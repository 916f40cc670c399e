/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.duke.cs.cmapalign.control;

import edu.duke.cs.cmapalign.align.ProjectedContactMap;
import edu.duke.cs.cmapalign.search.SearchHit;

/**
 *
 * A search hit together with the contact map projected through it
 *
 * @author mhall44
 */
public class HitProjection {

    SearchHit hit;
    ProjectedContactMap contactMap;

    public HitProjection(SearchHit hit, ProjectedContactMap contactMap){
        this.hit = hit;
        this.contactMap = contactMap;
    }

    public SearchHit getHit(){
        return hit;
    }

    public ProjectedContactMap getContactMap(){
        return contactMap;
    }
}
