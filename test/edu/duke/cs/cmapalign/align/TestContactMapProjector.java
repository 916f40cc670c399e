package edu.duke.cs.cmapalign.align;

import static org.junit.jupiter.api.Assertions.*;

import edu.duke.cs.cmapalign.contacts.ContactMapBuilder;
import edu.duke.cs.cmapalign.contacts.DenseContactGraph;
import edu.duke.cs.cmapalign.contacts.SparseContactGraph;
import edu.duke.cs.cmapalign.control.ConfigurationException;
import edu.duke.cs.cmapalign.structure.ResidueCoords;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.Test;

public class TestContactMapProjector {

    static List<int[]> pairs(int[]... pairs){
        return new ArrayList<>(Arrays.asList(pairs));
    }

    static void assertWellFormed(ProjectedContactMap cmap, int expectedSize){
        assertEquals(expectedSize, cmap.getNumRes());
        assertTrue(cmap.isSymmetric());
        for(int i=0; i<expectedSize; i++){
            assertTrue(cmap.isContact(i,i));
            for(int j=0; j<expectedSize; j++)
                assertEquals(cmap.isContact(i,j), cmap.isContact(j,i));
        }
    }

    @Test
    public void testNoGaps() {
        ProjectedContactMap cmap = ContactMapProjector.project("ABCDE", "ABCDE",
                pairs(new int[] {0,1}, new int[] {2,4}), 2);

        assertWellFormed(cmap, 5);
        assertTrue(cmap.isContact(0,1));
        assertTrue(cmap.isContact(1,0));
        assertTrue(cmap.isContact(2,4));
        assertTrue(cmap.isContact(4,2));
        assertEquals(2, cmap.countContacts());

        int[][] expected = new int[][] {
            {1,1,0,0,0},
            {1,1,0,0,0},
            {0,0,1,0,1},
            {0,0,0,1,0},
            {0,0,1,0,1}
        };
        assertArrayEquals(expected, cmap.toIntMatrix());
    }

    @Test
    public void testTargetGapGeneratedContacts() {
        ProjectedContactMap cmap = ContactMapProjector.project("ABCDE", "AB-DE", pairs(), 1);

        assertWellFormed(cmap, 5);
        assertTrue(cmap.isContact(1,2));
        assertTrue(cmap.isContact(2,1));
        assertTrue(cmap.isContact(3,2));
        assertTrue(cmap.isContact(2,3));
        assertEquals(2, cmap.countContacts());
    }

    @Test
    public void testTargetGapWithTemplateContacts() {
        //template A-E contact (0,3) lands on query (0,4)
        ProjectedContactMap cmap = ContactMapProjector.project("ABCDE", "AB-DE",
                pairs(new int[] {0,3}, new int[] {3,0}, new int[] {1,2}), 1);

        assertWellFormed(cmap, 5);
        assertTrue(cmap.isContact(0,4));
        assertTrue(cmap.isContact(1,3));//template B-D
        assertTrue(cmap.isContact(1,2));
        assertTrue(cmap.isContact(2,3));
        assertFalse(cmap.isContact(0,2));
        assertEquals(4, cmap.countContacts());
    }

    @Test
    public void testLengthMismatch() {
        assertThrows(AlignmentLengthMismatchException.class,
                () -> ContactMapProjector.project("ABCDE", "ABCD", pairs(new int[] {0,1}), 2));
    }

    @Test
    public void testNegativeRadius() {
        assertThrows(ConfigurationException.class,
                () -> ContactMapProjector.project("ABCDE", "ABCDE", pairs(), -1));
        assertThrows(ConfigurationException.class, () -> new ContactMapProjector(-3));
    }

    @Test
    public void testUnmappedContactsDropped() {
        //template C faces a query gap, so its contacts go
        ProjectedContactMap cmap = ContactMapProjector.project("AB-DE", "ABCDE",
                pairs(new int[] {2,0}, new int[] {0,2}, new int[] {2,4}, new int[] {1,4}), 2);

        assertWellFormed(cmap, 4);
        assertEquals(1, cmap.countContacts());
        assertTrue(cmap.isContact(1,3));//template B-E -> query B-E
    }

    @Test
    public void testContactsOutsideAlignmentDropped() {
        //template has more residues than made it into the (local) alignment
        ProjectedContactMap cmap = ContactMapProjector.project("ABC", "ABC",
                pairs(new int[] {0,1}, new int[] {1,7}, new int[] {9,9}), 0);

        assertWellFormed(cmap, 3);
        assertEquals(1, cmap.countContacts());
    }

    @Test
    public void testBoundsSafety() {
        //template gaps over the first and last query residues push generated contacts off both ends
        ProjectedContactMap cmap = ContactMapProjector.project("ABCDEF", "-BCDE-", pairs(), 3);

        assertWellFormed(cmap, 6);
        for(int offset=1; offset<=3; offset++){
            assertTrue(cmap.isContact(0,offset));
            assertTrue(cmap.isContact(5,5-offset));
        }
        assertFalse(cmap.isContact(0,4));
        assertFalse(cmap.isContact(1,5));
        assertEquals(6, cmap.countContacts());
    }

    @Test
    public void testAllTemplateGaps() {
        ProjectedContactMap cmap = ContactMapProjector.project("ABC", "---", pairs(), 2);
        assertWellFormed(cmap, 3);
        assertEquals(3, cmap.countContacts());
    }

    @Test
    public void testEmptyQuery() {
        ProjectedContactMap cmap = ContactMapProjector.project("---", "ABC", pairs(new int[] {0,1}), 2);
        assertEquals(0, cmap.getNumRes());
        assertEquals(0, cmap.countContacts());
    }

    @Test
    public void testDoubleGapColumn() {
        ProjectedContactMap withDoubleGap = ContactMapProjector.project("AB-CD", "AB-CD",
                pairs(new int[] {0,3}), 1);
        ProjectedContactMap without = ContactMapProjector.project("ABCD", "ABCD",
                pairs(new int[] {0,3}), 1);
        assertEquals(without, withDoubleGap);
    }

    @Test
    public void testDuplicatesDontMatter() {
        Alignment aln = new Alignment("ABC-DEFG", "A-CXDE-G");
        ContactMapProjector projector = new ContactMapProjector(2);

        ProjectedContactMap dedup = projector.project(aln, pairs(new int[] {0,4}, new int[] {1,3}));
        ProjectedContactMap dup = projector.project(aln, pairs(new int[] {0,4}, new int[] {4,0},
                new int[] {1,3}, new int[] {3,1}, new int[] {0,4}, new int[] {0,0}, new int[] {2,2}));
        assertEquals(dedup, dup);
    }

    @Test
    public void testIdentityAlignment() {
        Random rand = new Random(7);
        int numRes = 60;
        double[][] points = new double[numRes][3];
        for(int r=1; r<numRes; r++){
            for(int dim=0; dim<3; dim++)
                points[r][dim] = points[r-1][dim] + 4.4*(rand.nextDouble()-0.5);
        }
        ResidueCoords coords = ResidueCoords.fromPoints(points);

        ContactMapBuilder builder = new ContactMapBuilder();
        DenseContactGraph dense = builder.buildDense(coords);
        SparseContactGraph sparse = builder.buildSparse(coords);

        StringBuilder seq = new StringBuilder();
        for(int r=0; r<numRes; r++)
            seq.append("ACDEFGHIKLMNPQRSTVWY".charAt(r%20));

        ProjectedContactMap cmap = new ContactMapProjector()
                .project(new Alignment(seq.toString(), seq.toString()), sparse);

        assertWellFormed(cmap, numRes);
        for(int i=0; i<numRes; i++){
            for(int j=0; j<numRes; j++)
                assertEquals(dense.isContact(i,j), cmap.isContact(i,j));
        }
    }

    @Test
    public void testIdentityAlignmentOfTruncatedStructure() {
        //structure capped at 3 residues, query covers the first 3
        ResidueCoords coords = ResidueCoords.fromPoints(new double[][] { {0,0,0}, {1,0,0}, {10,0,0}, {11,0,0} });
        SparseContactGraph sparse = new ContactMapBuilder(6.0, 3).buildSparse(coords);

        ProjectedContactMap cmap = new ContactMapProjector().project(new Alignment("ABC", "ABC"), sparse);
        assertWellFormed(cmap, 3);
        assertTrue(cmap.isContact(0,1));
        assertFalse(cmap.isContact(1,2));
        assertEquals(1, cmap.countContacts());
    }

    @Test
    public void testHugeRadius() {
        //a radius far beyond the query length gives the same map as one equal to it
        ProjectedContactMap huge = assertTimeoutPreemptively(Duration.ofSeconds(10),
                () -> {
                    return ContactMapProjector.project("AB", "A-", Collections.<int[]>emptyList(), Integer.MAX_VALUE);
                });
        assertEquals(2, huge.getNumRes());
        assertTrue(huge.isContact(1,0));
        assertEquals(1, huge.countContacts());

        ProjectedContactMap big = ContactMapProjector.project("ABCDEFG", "A-C-E-G", pairs(), 100000000);
        assertEquals(ContactMapProjector.project("ABCDEFG", "A-C-E-G", pairs(), 7), big);
        //every pair touching an uncovered query residue (1, 3 or 5)
        assertEquals(15, big.countContacts());
    }
}
