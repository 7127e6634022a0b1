package com.cliffc.wf.space;

import com.cliffc.wf.FormErr;
import com.cliffc.wf.sig.Renumbering;
import com.cliffc.wf.sig.Tup;
import com.cliffc.wf.util.Counted;
import org.jetbrains.annotations.NotNull;

// A counted domain over one cell.  Two meshes with the same id and cell are
// the same mesh.
public final class Mesh implements Domain, Counted {
  public final Cell _cell;
  public final int _id;
  public final int _gdim;
  public Mesh( @NotNull Cell cell, int id ) { this(cell,id,cell._tdim); }
  public Mesh( @NotNull Cell cell, int id, int gdim ) {
    if( cell.is_mixed() ) throw FormErr.construct("Mesh","A mesh lives on a single cell, not "+cell);
    if( gdim < cell._tdim ) throw FormErr.construct("Mesh","Geometric dimension "+gdim+" below topological dimension of "+cell);
    _cell=cell; _id=id; _gdim=gdim;
  }

  @Override public Cell ufl_cell() { return _cell; }
  @Override public int geometric_dimension() { return _gdim; }
  @Override public int count() { return _id; }

  @Override public Tup hash_data() { return Tup.make("Mesh",_id,_gdim,_cell.hash_data()); }
  @Override public Tup signature_data( Renumbering r ) { return Tup.make("Mesh",r.at(this),_gdim,_cell.hash_data()); }

  @Override public boolean equals( Object o ) {
    if( this==o ) return true;
    return o instanceof Mesh m && _id==m._id && _gdim==m._gdim && _cell.equals(m._cell);
  }
  @Override public int hashCode() { return hash_data().hashCode(); }
  @Override public String toString() { return "Mesh("+_cell+", "+_id+")"; }
}
