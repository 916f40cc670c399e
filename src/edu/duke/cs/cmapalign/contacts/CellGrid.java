/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.duke.cs.cmapalign.contacts;

import cern.colt.bitvector.BitMatrix;
import edu.duke.cs.cmapalign.structure.ResidueCoords;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;

/**
 *
 * Uniform grid over residue positions, cell edge = contact threshold
 * so any contact partner of a residue is in its own cell or one of the 26 around it
 * Gives the same contacts as the full distance matrix without the N^2 matrix
 *
 * @author mhall44
 */
class CellGrid {

    ResidueCoords coords;
    double cellEdge;
    HashMap<List<Integer>,ArrayList<Integer>> cells = new HashMap<>();//cell coords -> residues in cell

    CellGrid(ResidueCoords coords, double cellEdge){
        this.coords = coords;
        this.cellEdge = cellEdge;
        for(int res=0; res<coords.getNumRes(); res++){
            cells.computeIfAbsent(cellOf(res), k -> new ArrayList<>()).add(res);
        }
    }

    private List<Integer> cellOf(int res){
        return Arrays.asList( cellIndex(res,0), cellIndex(res,1), cellIndex(res,2) );
    }

    private int cellIndex(int res, int dim){
        return (int)Math.floor(coords.getCoord(res,dim)/cellEdge);
    }


    BitMatrix findContacts(double threshold){
        int numRes = coords.getNumRes();
        BitMatrix ans = new BitMatrix(numRes, numRes);

        for(int res=0; res<numRes; res++){
            int cx = cellIndex(res,0);
            int cy = cellIndex(res,1);
            int cz = cellIndex(res,2);
            for(int dx=-1; dx<=1; dx++){
                for(int dy=-1; dy<=1; dy++){
                    for(int dz=-1; dz<=1; dz++){
                        ArrayList<Integer> cell = cells.get(Arrays.asList(cx+dx,cy+dy,cz+dz));
                        if(cell==null)
                            continue;
                        for(int res2 : cell){
                            if(coords.distance(res,res2) < threshold)
                                ans.putQuick(res, res2, true);
                        }
                    }
                }
            }
        }

        return ans;
    }
}
