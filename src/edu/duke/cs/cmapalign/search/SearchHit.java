/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.duke.cs.cmapalign.search;

import edu.duke.cs.cmapalign.align.Alignment;

/**
 *
 * One query-template hit from a homology search
 * Numeric fields not reported by the search are NaN (doubles) or -1 (ints);
 * alignment strings not reported are null
 *
 * @author mhall44
 */
public class SearchHit {

    String query;
    String target;

    double fident = Double.NaN;
    int alnlen = -1;
    int mismatch = -1;
    int gapopen = -1;
    int qstart = -1;
    int qend = -1;
    int tstart = -1;
    int tend = -1;
    double qcov = Double.NaN;
    double tcov = Double.NaN;
    double evalue = Double.NaN;
    double bits = Double.NaN;

    String qaln = null;
    String taln = null;


    public SearchHit(String query, String target){
        this.query = query;
        this.target = target;
    }

    public SearchHit(String query, String target, double fident, double evalue, double bits,
            String qaln, String taln){
        this(query, target);
        this.fident = fident;
        this.evalue = evalue;
        this.bits = bits;
        this.qaln = qaln;
        this.taln = taln;
    }


    void setValue(SearchColumn col, String val){
        //from a table cell
        try {
            switch(col){
                case QUERY: query = val; break;
                case TARGET: target = val; break;
                case FIDENT: fident = Double.parseDouble(val); break;
                case ALNLEN: alnlen = Integer.parseInt(val); break;
                case MISMATCH: mismatch = Integer.parseInt(val); break;
                case GAPOPEN: gapopen = Integer.parseInt(val); break;
                case QSTART: qstart = Integer.parseInt(val); break;
                case QEND: qend = Integer.parseInt(val); break;
                case TSTART: tstart = Integer.parseInt(val); break;
                case TEND: tend = Integer.parseInt(val); break;
                case QCOV: qcov = Double.parseDouble(val); break;
                case TCOV: tcov = Double.parseDouble(val); break;
                case EVALUE: evalue = Double.parseDouble(val); break;
                case BITS: bits = Double.parseDouble(val); break;
                case QALN: qaln = val.isEmpty() ? null : val; break;
                case TALN: taln = val.isEmpty() ? null : val; break;
                default: throw new RuntimeException("ERROR: unrecognized column "+col);
            }
        }
        catch(NumberFormatException e){
            throw new RuntimeException("ERROR: bad value "+val+" for column "+col.getHeader(), e);
        }
    }


    String getValue(SearchColumn col){
        //for writing a table cell
        switch(col){
            case QUERY: return query;
            case TARGET: return target;
            case FIDENT: return Double.toString(fident);
            case ALNLEN: return Integer.toString(alnlen);
            case MISMATCH: return Integer.toString(mismatch);
            case GAPOPEN: return Integer.toString(gapopen);
            case QSTART: return Integer.toString(qstart);
            case QEND: return Integer.toString(qend);
            case TSTART: return Integer.toString(tstart);
            case TEND: return Integer.toString(tend);
            case QCOV: return Double.toString(qcov);
            case TCOV: return Double.toString(tcov);
            case EVALUE: return Double.toString(evalue);
            case BITS: return Double.toString(bits);
            case QALN: return qaln==null ? "" : qaln;
            case TALN: return taln==null ? "" : taln;
            default: throw new RuntimeException("ERROR: unrecognized column "+col);
        }
    }


    public String getStructureId(){
        //target names carry a trailing chain/model suffix after the last dot; the structure lookup key doesn't
        int dot = target.lastIndexOf('.');
        if(dot==-1)
            return target;
        return target.substring(0,dot);
    }

    public boolean hasAlignment(){
        return qaln!=null && taln!=null;
    }

    public Alignment getAlignment(){
        if(!hasAlignment())
            throw new RuntimeException("ERROR: hit "+getHitId()+" has no alignment strings");
        return new Alignment(qaln, taln);
    }

    public String getHitId(){
        return query+"/"+target;
    }

    public String getQuery(){
        return query;
    }

    public String getTarget(){
        return target;
    }

    public double getIdentity(){
        return fident;
    }

    public double getEValue(){
        return evalue;
    }

    public double getBitScore(){
        return bits;
    }

    public int getAlignmentLength(){
        return alnlen;
    }

    public String getQueryAlignment(){
        return qaln;
    }

    public String getTargetAlignment(){
        return taln;
    }

    @Override
    public String toString(){
        return getHitId();
    }
}
