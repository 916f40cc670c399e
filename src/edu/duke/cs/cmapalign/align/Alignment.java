/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.duke.cs.cmapalign.align;

/**
 *
 * A gapped pairwise alignment of a query sequence to a template (target) sequence
 * Column c pairs query.charAt(c) with target.charAt(c)
 *
 * @author mhall44
 */
public class Alignment {

    public static final char GAP = '-';

    final String query;
    final String target;

    public Alignment(String query, String target){
        if(query.length()!=target.length())
            throw new AlignmentLengthMismatchException(query.length(), target.length());
        this.query = query;
        this.target = target;
    }

    public int getNumColumns(){
        return query.length();
    }

    public boolean queryGap(int col){
        return query.charAt(col)==GAP;
    }

    public boolean targetGap(int col){
        return target.charAt(col)==GAP;
    }

    public int getQueryLength(){
        //number of query residues (non-gap symbols)
        return countResidues(query);
    }

    public int getTargetLength(){
        return countResidues(target);
    }

    public String getQuery(){
        return query;
    }

    public String getTarget(){
        return target;
    }

    static int countResidues(String alignedSeq){
        int ans = 0;
        for(int col=0; col<alignedSeq.length(); col++){
            if(alignedSeq.charAt(col)!=GAP)
                ans++;
        }
        return ans;
    }

    @Override
    public String toString(){
        return query+"\n"+target;
    }
}
