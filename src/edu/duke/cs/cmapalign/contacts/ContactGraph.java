/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.duke.cs.cmapalign.contacts;

/**
 *
 * Which residues of a structure are within the contact threshold of each other
 * Residue i is always in contact with itself
 *
 * @author mhall44
 */
public abstract class ContactGraph {

    public abstract int getNumRes();

    public abstract boolean isContact(int res1, int res2);

    public abstract ContactMode getMode();

    public boolean isEmpty(){
        return getNumRes()==0;
    }

    void checkRes(int res){
        if(res<0 || res>=getNumRes())
            throw new IndexOutOfBoundsException("Residue "+res+" not in contact graph of size "+getNumRes());
    }
}
