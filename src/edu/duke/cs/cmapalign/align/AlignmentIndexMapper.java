/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.duke.cs.cmapalign.align;

import edu.duke.cs.cmapalign.control.ConfigurationException;

/**
 *
 * Walks an alignment column by column, keeping separate ungapped residue counters
 * for the query and the template, to work out which template residue goes with which query residue
 *
 * Query residues aligned to template gaps have no template contacts to inherit,
 * so they get generated contacts to their generatedContacts nearest sequence neighbors on each side
 * (assumes the chain is locally connected)
 *
 * @author mhall44
 */
public class AlignmentIndexMapper {

    final int generatedContacts;

    public AlignmentIndexMapper(int generatedContacts){
        ConfigurationException.checkGeneratedContacts(generatedContacts);
        this.generatedContacts = generatedContacts;
    }


    public AlignmentScan scan(Alignment aln){
        AlignmentScan ans = new AlignmentScan();
        int targetIndex = 0;
        int queryIndex = 0;
        //offsets at or past the query length always land outside the query
        int radius = Math.min(generatedContacts, aln.getQueryLength());

        for(int col=0; col<aln.getNumColumns(); col++){
            if(aln.queryGap(col)){
                if(!aln.targetGap(col)){
                    //template residue with nowhere to go in the query
                    ans.correspondence.add(targetIndex, MappedIndex.UNMAPPED);
                    targetIndex++;
                }
                //else gap on both sides: no residue in this column at all, skip it
            }
            else if(aln.targetGap(col)){
                //query residue not covered by the template
                for(int offset=1; offset<=radius; offset++){
                    ans.generatedContacts.add(new GeneratedContact(queryIndex+offset, queryIndex));
                    ans.generatedContacts.add(new GeneratedContact(queryIndex-offset, queryIndex));
                }
                queryIndex++;
            }
            else {//aligned residues
                ans.correspondence.add(targetIndex, MappedIndex.of(queryIndex));
                queryIndex++;
                targetIndex++;
            }
        }

        ans.numQueryRes = queryIndex;
        ans.numTargetRes = targetIndex;
        return ans;
    }


    public int getGeneratedContacts(){
        return generatedContacts;
    }
}
