/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.duke.cs.cmapalign.control;

import java.io.Serializable;

/**
 *
 * Settings for building and projecting contact maps
 *
 * @author mhall44
 */
@SuppressWarnings("serial")
public class ContactMapSettings implements Serializable {

    public double contactThreshold = 6.0;//Angstroms
    public int maxSeqLen = 1000;
    public int generatedContacts = 2;
    public boolean useCellGrid = false;

    public int numThreads = 1;
    public boolean abortOnFailure = false;//else skip failed hits and keep going

    public ContactMapSettings(){
        //defaults
    }

    public ContactMapSettings(double contactThreshold, int maxSeqLen, int generatedContacts){
        this.contactThreshold = contactThreshold;
        this.maxSeqLen = maxSeqLen;
        this.generatedContacts = generatedContacts;
        validate();
    }

    public ContactMapSettings(ParamSet params){
        //initialize from input parameter set
        contactThreshold = params.getDouble("CONTACTTHRESHOLD", contactThreshold);
        maxSeqLen = params.getInt("MAXSEQLEN", maxSeqLen);
        generatedContacts = params.getInt("GENERATEDCONTACTS", generatedContacts);
        useCellGrid = params.getBool("USECELLGRID", useCellGrid);
        numThreads = params.getInt("NUMTHREADS", numThreads);
        abortOnFailure = params.getBool("ABORTONFAILURE", abortOnFailure);
        validate();
    }

    public void validate(){
        ConfigurationException.checkThreshold(contactThreshold);
        ConfigurationException.checkMaxSeqLen(maxSeqLen);
        ConfigurationException.checkGeneratedContacts(generatedContacts);
        if(numThreads<1)
            throw new ConfigurationException("ERROR: need at least one thread, got "+numThreads);
    }
}
