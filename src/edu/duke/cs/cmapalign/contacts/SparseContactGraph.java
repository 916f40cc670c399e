/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.duke.cs.cmapalign.contacts;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 *
 * Contact graph as a list of (i,j) pairs
 * Not canonicalized: a contact usually shows up as both (i,j) and (j,i),
 * and every residue has its (i,i) self-contact
 *
 * @author mhall44
 */
public class SparseContactGraph extends ContactGraph {

    int numRes;
    ArrayList<int[]> pairs;

    public SparseContactGraph(int numRes, List<int[]> pairs){
        this.numRes = numRes;
        this.pairs = new ArrayList<>(pairs);
    }

    @Override
    public int getNumRes(){
        return numRes;
    }

    @Override
    public boolean isContact(int res1, int res2){
        checkRes(res1);
        checkRes(res2);
        if(res1==res2)
            return true;
        for(int[] pair : pairs){
            if( (pair[0]==res1 && pair[1]==res2) || (pair[0]==res2 && pair[1]==res1) )
                return true;
        }
        return false;
    }

    @Override
    public ContactMode getMode(){
        return ContactMode.SPARSE;
    }

    public List<int[]> getPairs(){
        return Collections.unmodifiableList(pairs);
    }

    public int getNumPairs(){
        return pairs.size();
    }
}
