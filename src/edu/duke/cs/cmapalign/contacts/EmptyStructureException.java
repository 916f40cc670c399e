/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.duke.cs.cmapalign.contacts;

/**
 *
 * A template structure came back with no usable residues
 * Fatal only for the hit that needed it
 *
 * @author mhall44
 */
@SuppressWarnings("serial")
public class EmptyStructureException extends RuntimeException {

    String structureId;

    public EmptyStructureException(String structureId){
        super("ERROR: structure "+structureId+" has no residues with coordinates");
        this.structureId = structureId;
    }

    public String getStructureId(){
        return structureId;
    }
}
