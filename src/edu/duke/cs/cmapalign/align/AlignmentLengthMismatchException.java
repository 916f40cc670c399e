/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.duke.cs.cmapalign.align;

import org.apache.commons.math3.exception.DimensionMismatchException;

/**
 *
 * Gapped query and target strings of different lengths can't be a pairwise alignment
 *
 * @author mhall44
 */
@SuppressWarnings("serial")
public class AlignmentLengthMismatchException extends DimensionMismatchException {

    int queryLength;
    int targetLength;

    public AlignmentLengthMismatchException(int queryLength, int targetLength){
        super(targetLength, queryLength);
        this.queryLength = queryLength;
        this.targetLength = targetLength;
    }

    @Override
    public String getMessage(){
        return "ERROR: gapped query alignment has length "+queryLength
                +" but gapped target alignment has length "+targetLength;
    }

    public int getQueryLength(){
        return queryLength;
    }

    public int getTargetLength(){
        return targetLength;
    }
}
