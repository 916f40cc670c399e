/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.duke.cs.cmapalign.control;

/**
 *
 * A parameter is missing, unparseable, or out of range
 * Always thrown before any contact-map work starts
 *
 * @author mhall44
 */
@SuppressWarnings("serial")
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message){
        super(message);
    }

    public ConfigurationException(String message, Throwable cause){
        super(message, cause);
    }

    public static void checkThreshold(double threshold){
        if( ! (threshold>0 && Double.isFinite(threshold)) )
            throw new ConfigurationException("ERROR: contact distance threshold must be positive, got "+threshold);
    }

    public static void checkMaxSeqLen(int maxSeqLen){
        if(maxSeqLen<=0)
            throw new ConfigurationException("ERROR: maximum sequence length must be positive, got "+maxSeqLen);
    }

    public static void checkGeneratedContacts(int generatedContacts){
        if(generatedContacts<0)
            throw new ConfigurationException("ERROR: generated-contact radius can't be negative, got "+generatedContacts);
    }
}
