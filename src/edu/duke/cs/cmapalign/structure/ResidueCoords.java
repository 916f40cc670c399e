/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.duke.cs.cmapalign.structure;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 *
 * Ordered residues of one chain (or structure), each represented by a single atom position
 * (CA for proteins).  Residue index = position in this ordering, nothing else.
 *
 * @author mhall44
 */
public class ResidueCoords {

    String id;//structure identifier, may be null
    ArrayList<String> resNames;//three-letter names
    double[] coords;//residue r is at 3*r..3*r+2
    int numRes;


    public ResidueCoords(String id, List<String> resNames, double[] coords){
        if(coords.length != 3*resNames.size()){
            throw new RuntimeException("ERROR: "+resNames.size()+" residues but "
                    +coords.length+" coordinates (expected 3 per residue)");
        }
        this.id = id;
        this.resNames = new ArrayList<>(resNames);
        this.coords = coords;
        numRes = resNames.size();
    }


    public static ResidueCoords fromPoints(double[][] points){
        //unnamed residues at the given points, mostly for testing
        ArrayList<String> names = new ArrayList<>();
        double[] coords = new double[3*points.length];
        for(int r=0; r<points.length; r++){
            if(points[r].length!=3)
                throw new RuntimeException("ERROR: point "+r+" has "+points[r].length+" coordinates");
            System.arraycopy(points[r], 0, coords, 3*r, 3);
            names.add("UNK");
        }
        return new ResidueCoords(null, names, coords);
    }


    public ResidueCoords truncate(int maxRes){
        //first maxRes residues (this object if already short enough)
        if(numRes<=maxRes)
            return this;
        return new ResidueCoords(id, resNames.subList(0,maxRes), Arrays.copyOf(coords,3*maxRes));
    }

    public double distance(int res1, int res2){
        double sum = 0;
        for(int dim=0; dim<3; dim++){
            double diff = coords[3*res1+dim] - coords[3*res2+dim];
            sum += diff*diff;
        }
        return Math.sqrt(sum);
    }

    public double getCoord(int res, int dim){
        return coords[3*res+dim];
    }

    public String getSequence(){
        StringBuilder sb = new StringBuilder();
        for(String name : resNames)
            sb.append(ProteinLetters.oneLetterCode(name));
        return sb.toString();
    }

    public int getNumRes(){
        return numRes;
    }

    public String getResName(int res){
        return resNames.get(res);
    }

    public String getId(){
        return id;
    }

    public boolean isEmpty(){
        return numRes==0;
    }
}
