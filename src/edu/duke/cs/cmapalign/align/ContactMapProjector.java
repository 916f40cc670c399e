/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.duke.cs.cmapalign.align;

import edu.duke.cs.cmapalign.contacts.SparseContactGraph;
import edu.duke.cs.cmapalign.control.ConfigurationException;
import java.util.ArrayList;
import java.util.List;

/**
 *
 * Projects a template's contact map onto a query sequence through their alignment,
 * so one solved (or predicted) structure can stand in for all its homologs
 *
 * Template contacts between residues that both align to query residues are carried over;
 * template residues facing query gaps drop out;
 * query residues facing template gaps get generated contacts to their sequence neighbors
 *
 * Stateless after construction
 *
 * @author mhall44
 */
public class ContactMapProjector {

    public static final int DEFAULT_GENERATED_CONTACTS = 2;

    AlignmentIndexMapper mapper;

    public ContactMapProjector(){
        this(DEFAULT_GENERATED_CONTACTS);
    }

    public ContactMapProjector(int generatedContacts){
        mapper = new AlignmentIndexMapper(generatedContacts);
    }


    /**
     * Project with an explicit generated-contact radius
     * Parameters and alignment lengths are checked before the scan starts
     */
    public static ProjectedContactMap project(String queryAlignment, String targetAlignment,
            List<int[]> sparseTargetContacts, int generatedContacts){
        ConfigurationException.checkGeneratedContacts(generatedContacts);
        Alignment aln = new Alignment(queryAlignment, targetAlignment);
        return new ContactMapProjector(generatedContacts).project(aln, sparseTargetContacts);
    }

    public ProjectedContactMap project(Alignment aln, SparseContactGraph targetContacts){
        return project(aln, targetContacts.getPairs());
    }


    public ProjectedContactMap project(Alignment aln, List<int[]> sparseTargetContacts){
        AlignmentScan scan = mapper.scan(aln);

        //generated contacts first, then the ones translated from the template
        ArrayList<int[]> queryContacts = new ArrayList<>();
        for(GeneratedContact gc : scan.generatedContacts)
            queryContacts.add(gc.toPair());
        translateContacts(sparseTargetContacts, scan.correspondence, queryContacts);

        int numQueryRes = scan.numQueryRes;
        ProjectedContactMap ans = new ProjectedContactMap(numQueryRes);
        for(int[] contact : queryContacts){
            //generated contacts can run off the ends of the query.  The second index
            //(generated-contact center or translated index) is always in range
            if(contact[0]<0 || contact[0]>=numQueryRes)
                continue;
            ans.setContact(contact[0], contact[1]);
        }

        return ans;
    }


    static void translateContacts(List<int[]> targetContacts, IndexCorrespondence correspondence,
            ArrayList<int[]> queryContacts){
        //template contacts -> query index space, dropping any with an end that doesn't map
        for(int[] contact : targetContacts){
            MappedIndex q1 = correspondence.get(contact[0]);
            MappedIndex q2 = correspondence.get(contact[1]);
            if(q1==null || q2==null)//template residue outside the alignment
                continue;
            if(q1.isMapped() && q2.isMapped())
                queryContacts.add(new int[] {q1.getIndex(), q2.getIndex()});
        }
    }


    public int getGeneratedContacts(){
        return mapper.getGeneratedContacts();
    }
}
