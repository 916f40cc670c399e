/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.duke.cs.cmapalign.contacts;

import cern.colt.bitvector.BitMatrix;
import cern.colt.matrix.DoubleFactory2D;
import cern.colt.matrix.DoubleMatrix2D;
import edu.duke.cs.cmapalign.control.ConfigurationException;
import edu.duke.cs.cmapalign.control.ContactMapSettings;
import edu.duke.cs.cmapalign.structure.ResidueCoords;

/**
 *
 * Builds residue contact graphs from coordinates by distance thresholding
 * Structures longer than maxSeqLen are cut off at the end
 *
 * Stateless after construction, so one builder can be shared by many threads
 *
 * @author mhall44
 */
public class ContactMapBuilder {

    public static final double DEFAULT_THRESHOLD = 6.0;
    public static final int DEFAULT_MAX_SEQ_LEN = 1000;

    final double threshold;//contact iff distance < threshold (strictly)
    final int maxSeqLen;
    final boolean useCellGrid;//find contacts with a CellGrid instead of the distance matrix

    public ContactMapBuilder(){
        this(DEFAULT_THRESHOLD, DEFAULT_MAX_SEQ_LEN, false);
    }

    public ContactMapBuilder(double threshold, int maxSeqLen){
        this(threshold, maxSeqLen, false);
    }

    public ContactMapBuilder(double threshold, int maxSeqLen, boolean useCellGrid){
        ConfigurationException.checkThreshold(threshold);
        ConfigurationException.checkMaxSeqLen(maxSeqLen);
        this.threshold = threshold;
        this.maxSeqLen = maxSeqLen;
        this.useCellGrid = useCellGrid;
    }

    public ContactMapBuilder(ContactMapSettings settings){
        this(settings.contactThreshold, settings.maxSeqLen, settings.useCellGrid);
    }


    /**
     * One-off contact graph calculation with explicit parameters
     * (validated before anything is computed)
     */
    public static ContactGraph calcContactMap(ResidueCoords coords, double threshold, int maxSeqLen, ContactMode mode){
        return new ContactMapBuilder(threshold, maxSeqLen).build(coords, mode);
    }


    public ContactGraph build(ResidueCoords coords, ContactMode mode){
        switch(mode){
            case DENSE:
                return buildDense(coords);
            case SPARSE:
                return buildSparse(coords);
            default:
                throw new RuntimeException("ERROR: unrecognized contact mode "+mode);
        }
    }

    public DenseContactGraph buildDense(ResidueCoords coords){
        return new DenseContactGraph(findContacts(coords));
    }

    public SparseContactGraph buildSparse(ResidueCoords coords){
        return buildDense(coords).toSparse();
    }


    BitMatrix findContacts(ResidueCoords coords){
        //empty structures give an empty matrix; callers decide if that's an error
        ResidueCoords truncated = coords.truncate(maxSeqLen);
        if(useCellGrid)
            return new CellGrid(truncated, threshold).findContacts(threshold);

        DoubleMatrix2D dist = calcDistanceMatrix(truncated);
        int numRes = dist.rows();
        BitMatrix ans = new BitMatrix(numRes, numRes);
        for(int i=0; i<numRes; i++){
            for(int j=0; j<numRes; j++){
                if(dist.getQuick(i,j) < threshold)
                    ans.putQuick(i, j, true);
            }
        }
        return ans;
    }


    static DoubleMatrix2D calcDistanceMatrix(ResidueCoords coords){
        //all pairwise distances.  Diagonal is exactly 0
        int numRes = coords.getNumRes();
        DoubleMatrix2D dist = DoubleFactory2D.dense.make(numRes, numRes);
        for(int i=0; i<numRes; i++){
            for(int j=0; j<i; j++){
                double d = coords.distance(i,j);
                dist.setQuick(i, j, d);
                dist.setQuick(j, i, d);
            }
        }
        return dist;
    }


    public double getThreshold(){
        return threshold;
    }

    public int getMaxSeqLen(){
        return maxSeqLen;
    }
}
