/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.duke.cs.cmapalign.structure;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.HashMap;

/**
 *
 * Reads the CA trace out of PDB-format text
 * Only the first model is used; residues are in file order
 * Residues with no CA (waters, most ligands) are left out
 * A CA with alternate locations contributes the highest-occupancy conformer
 *
 * @author mhall44
 */
public class PDBCAReader {

    static final String REPRESENTATIVE_ATOM = "CA";


    public static ResidueCoords read(String id, String pdbText){
        try {
            return read(id, new StringReader(pdbText));
        }
        catch(IOException e){//not expected from a StringReader
            throw new RuntimeException(e);
        }
    }


    public static ResidueCoords read(String id, Reader input) throws IOException {
        BufferedReader br = new BufferedReader(input);

        ArrayList<String> resNames = new ArrayList<>();
        ArrayList<Double> coordList = new ArrayList<>();
        ArrayList<Double> occupancies = new ArrayList<>();//of the CA conformer we're keeping
        HashMap<String,Integer> resIndices = new HashMap<>();//residue key -> index in resNames

        String line;
        int lineNum = 0;
        while( (line=br.readLine()) != null ){
            lineNum++;
            if(line.startsWith("ENDMDL"))//first model only
                break;
            if( ! (line.startsWith("ATOM") || line.startsWith("HETATM")) )
                continue;
            if(line.length()<54)
                throw new RuntimeException("ERROR: truncated coordinate record at line "+lineNum+" of "+id);

            String atomName = line.substring(12,16).trim();
            if(!atomName.equals(REPRESENTATIVE_ATOM))
                continue;

            double x, y, z, occupancy;
            try {
                x = Double.parseDouble(line.substring(30,38).trim());
                y = Double.parseDouble(line.substring(38,46).trim());
                z = Double.parseDouble(line.substring(46,54).trim());
                occupancy = parseOccupancy(line);
            }
            catch(NumberFormatException e){
                throw new RuntimeException("ERROR: bad coordinate record at line "+lineNum+" of "+id+": "+line, e);
            }

            //residue identity = chain + number + insertion code
            //alternate conformers of the CA (any alt-loc label) share a key; highest occupancy wins, ties go to the first
            String resKey = line.substring(21,27);
            Integer res = resIndices.get(resKey);
            if(res==null){
                resIndices.put(resKey, resNames.size());
                resNames.add(line.substring(17,20).trim());
                coordList.add(x);
                coordList.add(y);
                coordList.add(z);
                occupancies.add(occupancy);
            }
            else if(occupancy > occupancies.get(res)){
                resNames.set(res, line.substring(17,20).trim());
                coordList.set(3*res, x);
                coordList.set(3*res+1, y);
                coordList.set(3*res+2, z);
                occupancies.set(res, occupancy);
            }
        }

        double[] coords = new double[coordList.size()];
        for(int c=0; c<coords.length; c++)
            coords[c] = coordList.get(c);

        return new ResidueCoords(id, resNames, coords);
    }


    private static double parseOccupancy(String line){
        //columns 55-60; missing means fully occupied
        if(line.length()<=54)
            return 1;
        String field = line.substring(54, Math.min(60, line.length())).trim();
        if(field.isEmpty())
            return 1;
        return Double.parseDouble(field);
    }
}
