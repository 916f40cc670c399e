/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.duke.cs.cmapalign.align;

/**
 *
 * Assumed contact between a query residue with no template counterpart (center)
 * and a sequence neighbor (res = center +/- offset)
 * Not measured; res may fall off either end of the query
 *
 * @author mhall44
 */
public class GeneratedContact {

    final int res;
    final int center;

    GeneratedContact(int res, int center){
        this.res = res;
        this.center = center;
    }

    public int getRes(){
        return res;
    }

    public int getCenter(){
        return center;
    }

    int[] toPair(){
        return new int[] {res, center};
    }

    @Override
    public String toString(){
        return "("+res+","+center+")";
    }
}
