/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.duke.cs.cmapalign.structure;

import java.io.IOException;

/**
 *
 * Somewhere we can look up template structures by identifier
 *
 * @author mhall44
 */
public interface StructureSource {

    ResidueCoords getStructure(String id) throws IOException;

    /**
     * If false, callers running several projections at once must not call
     * getStructure concurrently (e.g. archive formats with a single shared file handle)
     */
    default boolean isThreadSafe(){
        return true;
    }
}
