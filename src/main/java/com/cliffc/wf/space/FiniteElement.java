package com.cliffc.wf.space;

import com.cliffc.wf.FormErr;
import com.cliffc.wf.sig.Tup;
import com.cliffc.wf.util.SB;
import org.jetbrains.annotations.NotNull;

import java.util.Arrays;

// A family/degree element on a cell with a fixed value shape.  Scalar
// elements have shape (); vector elements (n,); tensor elements (n,m).
public final class FiniteElement implements Element {
  public final String _family;
  public final Cell _cell;
  public final int _degree;
  private final int[] _shape;
  public FiniteElement( @NotNull String family, @NotNull Cell cell, int degree, int... shape ) {
    if( degree < 0 ) throw FormErr.construct("FiniteElement","Negative degree "+degree);
    for( int d : shape )
      if( d < 0 ) throw FormErr.construct("FiniteElement","Negative value dimension in "+Arrays.toString(shape));
    _family=family; _cell=cell; _degree=degree; _shape=shape.clone();
  }
  // Vector element with one component per topological direction
  public static FiniteElement vector( String family, Cell cell, int degree ) {
    return new FiniteElement(family,cell,degree,cell._tdim);
  }

  @Override public Cell cell() { return _cell; }
  @Override public int[] value_shape() { return _shape.clone(); }
  @Override public boolean is_cellwise_constant() { return _degree==0; }
  @Override public Tup hash_data() {
    Object[] shape = new Object[_shape.length];
    for( int i=0; i<shape.length; i++ ) shape[i] = _shape[i];
    return Tup.make("FiniteElement",_family,_cell.hash_data(),_degree,Tup.make(shape));
  }

  @Override public boolean equals( Object o ) {
    if( this==o ) return true;
    return o instanceof FiniteElement e && _degree==e._degree && _family.equals(e._family) &&
      _cell.equals(e._cell) && Arrays.equals(_shape,e._shape);
  }
  @Override public int hashCode() { return hash_data().hashCode(); }
  @Override public String toString() {
    SB sb = new SB().p(_family).p('(').p(_cell._name).p(',').p(_degree);
    if( _shape.length>0 ) sb.p(',').pshape(_shape);
    return sb.p(')').toString();
  }
}
