/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.duke.cs.cmapalign.align;

/**
 *
 * Where a template residue lands in the query: either a query residue index,
 * or nowhere (UNMAPPED) because the query has a gap at that column
 *
 * @author mhall44
 */
public final class MappedIndex {

    public static final MappedIndex UNMAPPED = new MappedIndex(false, 0);

    private final boolean mapped;
    private final int index;

    private MappedIndex(boolean mapped, int index){
        this.mapped = mapped;
        this.index = index;
    }

    public static MappedIndex of(int index){
        if(index<0)
            throw new IllegalArgumentException("ERROR: query residue index can't be negative: "+index);
        return new MappedIndex(true, index);
    }

    public boolean isMapped(){
        return mapped;
    }

    public int getIndex(){
        if(!mapped)
            throw new IllegalStateException("ERROR: unmapped template residue has no query index");
        return index;
    }

    @Override
    public boolean equals(Object o){
        if(!(o instanceof MappedIndex))
            return false;
        MappedIndex mi = (MappedIndex)o;
        return mapped==mi.mapped && index==mi.index;
    }

    @Override
    public int hashCode(){
        return mapped ? index : -1;
    }

    @Override
    public String toString(){
        return mapped ? Integer.toString(index) : "UNMAPPED";
    }
}
