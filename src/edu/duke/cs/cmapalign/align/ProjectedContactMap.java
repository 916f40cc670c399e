/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.duke.cs.cmapalign.align;

import cern.colt.bitvector.BitMatrix;

/**
 *
 * Contact map for the query, inherited from a template through an alignment
 * Symmetric, with every residue in contact with itself
 *
 * @author mhall44
 */
public class ProjectedContactMap {

    BitMatrix contacts;

    ProjectedContactMap(int numRes){
        contacts = new BitMatrix(numRes, numRes);
        for(int res=0; res<numRes; res++)
            contacts.putQuick(res, res, true);
    }

    void setContact(int res1, int res2){
        contacts.putQuick(res1, res2, true);
        contacts.putQuick(res2, res1, true);
    }

    public int getNumRes(){
        return contacts.rows();
    }

    public boolean isContact(int res1, int res2){
        //bounds-checked
        return contacts.get(res1, res2);
    }

    public int countContacts(){
        //off-diagonal contacts, each unordered pair once
        return (contacts.cardinality()-getNumRes())/2;
    }

    public boolean isSymmetric(){
        int numRes = getNumRes();
        for(int i=0; i<numRes; i++){
            for(int j=0; j<i; j++){
                if(contacts.getQuick(i,j) != contacts.getQuick(j,i))
                    return false;
            }
        }
        return true;
    }

    public int[][] toIntMatrix(){
        //1 = contact, 0 = not; the form the function predictor takes
        int numRes = getNumRes();
        int[][] ans = new int[numRes][numRes];
        for(int i=0; i<numRes; i++){
            for(int j=0; j<numRes; j++){
                if(contacts.getQuick(i,j))
                    ans[i][j] = 1;
            }
        }
        return ans;
    }

    @Override
    public boolean equals(Object o){
        if(!(o instanceof ProjectedContactMap))
            return false;
        return contacts.equals(((ProjectedContactMap)o).contacts);
    }

    @Override
    public int hashCode(){
        return 31*getNumRes() + contacts.cardinality();
    }
}
