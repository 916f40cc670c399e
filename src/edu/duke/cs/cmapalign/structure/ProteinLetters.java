/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.duke.cs.cmapalign.structure;

import java.util.HashMap;

/**
 *
 * Three-letter to one-letter residue codes, including the ambiguous/rare ones
 *
 * @author mhall44
 */
public class ProteinLetters {

    private static final HashMap<String,Character> threeToOne = new HashMap<>();

    static {
        String[][] codes = new String[][] {
            {"ALA","A"}, {"CYS","C"}, {"ASP","D"}, {"GLU","E"}, {"PHE","F"},
            {"GLY","G"}, {"HIS","H"}, {"ILE","I"}, {"LYS","K"}, {"LEU","L"},
            {"MET","M"}, {"ASN","N"}, {"PRO","P"}, {"GLN","Q"}, {"ARG","R"},
            {"SER","S"}, {"THR","T"}, {"VAL","V"}, {"TRP","W"}, {"TYR","Y"},
            //extended
            {"ASX","B"}, {"XAA","X"}, {"GLX","Z"}, {"XLE","J"}, {"SEC","U"}, {"PYL","O"}, {"MSE","M"},
            {"UNK","X"}
        };
        for(String[] code : codes)
            threeToOne.put(code[0], code[1].charAt(0));
    }

    public static char oneLetterCode(String resName){
        //unrecognized names (ligands etc.) count as X
        Character ans = threeToOne.get(resName.trim().toUpperCase());
        if(ans==null)
            return 'X';
        return ans;
    }

    public static boolean isKnown(String resName){
        return threeToOne.containsKey(resName.trim().toUpperCase());
    }
}
