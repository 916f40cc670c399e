/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.duke.cs.cmapalign.align;

import java.util.ArrayList;

/**
 *
 * Template residue index -> query residue index, from an alignment
 * Template residues are visited in order by the scan, so the domain is always 0..size()-1
 *
 * @author mhall44
 */
public class IndexCorrespondence {

    private ArrayList<MappedIndex> targetToQuery = new ArrayList<>();

    void add(int targetIndex, MappedIndex queryIndex){
        if(targetIndex!=targetToQuery.size())//scan must go through template residues in order
            throw new RuntimeException("ERROR: expected template residue "+targetToQuery.size()+", got "+targetIndex);
        targetToQuery.add(queryIndex);
    }

    /**
     * Query index for a template residue.
     * null if the template residue never appeared in the alignment
     * (e.g. outside the aligned region of a local alignment)
     */
    public MappedIndex get(int targetIndex){
        if(targetIndex<0 || targetIndex>=targetToQuery.size())
            return null;
        return targetToQuery.get(targetIndex);
    }

    public boolean isMapped(int targetIndex){
        MappedIndex mi = get(targetIndex);
        return mi!=null && mi.isMapped();
    }

    public int size(){
        return targetToQuery.size();
    }

    public int countMapped(){
        int ans = 0;
        for(MappedIndex mi : targetToQuery){
            if(mi.isMapped())
                ans++;
        }
        return ans;
    }
}
