/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.duke.cs.cmapalign.align;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 *
 * What one pass over an alignment gives us:
 * the template->query index correspondence, the generated contacts for
 * template-less query residues, and the residue counts on each side
 *
 * @author mhall44
 */
public class AlignmentScan {

    IndexCorrespondence correspondence = new IndexCorrespondence();
    ArrayList<GeneratedContact> generatedContacts = new ArrayList<>();
    int numQueryRes = 0;
    int numTargetRes = 0;

    AlignmentScan(){
    }

    public IndexCorrespondence getCorrespondence(){
        return correspondence;
    }

    public List<GeneratedContact> getGeneratedContacts(){
        return Collections.unmodifiableList(generatedContacts);
    }

    public int getNumQueryRes(){
        return numQueryRes;
    }

    public int getNumTargetRes(){
        return numTargetRes;
    }
}
