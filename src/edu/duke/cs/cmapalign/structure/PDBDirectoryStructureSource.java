/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.duke.cs.cmapalign.structure;

import java.io.File;
import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.zip.GZIPInputStream;

/**
 *
 * Template structures stored as one PDB file per identifier in a directory
 * (plain or gzipped)
 *
 * @author mhall44
 */
public class PDBDirectoryStructureSource implements StructureSource {

    static final String[] suffixes = new String[] {".pdb", ".pdb.gz", ".ent", ""};

    File dir;

    public PDBDirectoryStructureSource(File dir){
        if(!dir.isDirectory())
            throw new RuntimeException("ERROR: structure directory "+dir+" doesn't exist");
        this.dir = dir;
    }

    File findFile(String id) throws FileNotFoundException {
        for(String suffix : suffixes){
            File f = new File(dir, id+suffix);
            if(f.isFile())
                return f;
        }
        throw new FileNotFoundException("No structure file for "+id+" in "+dir);
    }

    @Override
    public ResidueCoords getStructure(String id) throws IOException {
        File f = findFile(id);
        try(InputStream fis = new FileInputStream(f)){
            InputStream is = f.getName().endsWith(".gz") ? new GZIPInputStream(fis) : fis;
            Reader reader = new InputStreamReader(is, StandardCharsets.UTF_8);
            return PDBCAReader.read(id, reader);
        }
    }
}
