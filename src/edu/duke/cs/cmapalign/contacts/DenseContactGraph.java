/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.duke.cs.cmapalign.contacts;

import cern.colt.bitvector.BitMatrix;
import java.util.ArrayList;

/**
 *
 * Contact graph as a symmetric bit matrix
 *
 * @author mhall44
 */
public class DenseContactGraph extends ContactGraph {

    BitMatrix contacts;

    DenseContactGraph(BitMatrix contacts){
        if(contacts.columns()!=contacts.rows())
            throw new RuntimeException("ERROR: contact matrix must be square");
        this.contacts = contacts;
    }

    @Override
    public int getNumRes(){
        return contacts.rows();
    }

    @Override
    public boolean isContact(int res1, int res2){
        checkRes(res1);
        checkRes(res2);
        return contacts.getQuick(res1, res2);
    }

    @Override
    public ContactMode getMode(){
        return ContactMode.DENSE;
    }

    public int countContacts(){
        //counts (i,j) and (j,i) separately, and the diagonal
        return contacts.cardinality();
    }

    public SparseContactGraph toSparse(){
        //row-major, both orderings, diagonal included
        int numRes = getNumRes();
        ArrayList<int[]> pairs = new ArrayList<>();
        for(int i=0; i<numRes; i++){
            for(int j=0; j<numRes; j++){
                if(contacts.getQuick(i,j))
                    pairs.add(new int[] {i,j});
            }
        }
        return new SparseContactGraph(numRes, pairs);
    }
}
