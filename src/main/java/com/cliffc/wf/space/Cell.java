package com.cliffc.wf.space;

import com.cliffc.wf.FormErr;
import com.cliffc.wf.sig.Tup;
import com.cliffc.wf.util.SB;

import java.util.Arrays;

// Reference cell handle.  Only its name and topological dimension matter
// here; a mixed cell is an ordered tuple of cells.
public final class Cell {
  public final String _name;
  public final int _tdim;
  final Cell[] _cells;          // Non-null only for a mixed cell
  private Cell( String name, int tdim, Cell[] cells ) { _name=name; _tdim=tdim; _cells=cells; }
  public Cell( String name, int tdim ) { this(name,tdim,null); }

  public static final Cell VERTEX        = new Cell("vertex"       ,0);
  public static final Cell INTERVAL      = new Cell("interval"     ,1);
  public static final Cell TRIANGLE      = new Cell("triangle"     ,2);
  public static final Cell QUADRILATERAL = new Cell("quadrilateral",2);
  public static final Cell TETRAHEDRON   = new Cell("tetrahedron"  ,3);
  public static final Cell HEXAHEDRON    = new Cell("hexahedron"   ,3);

  public static Cell mixed( Cell... cells ) {
    if( cells.length==0 ) throw FormErr.construct("Cell","Mixed cell needs at least one cell");
    SB sb = new SB().p("mixed(");
    int tdim=0;
    for( Cell c : cells ) {
      if( c.is_mixed() ) throw FormErr.construct("Cell","Nested mixed cells are not supported");
      sb.p(c._name).p(',');
      tdim = Math.max(tdim,c._tdim);
    }
    return new Cell(sb.unchar().p(')').toString(),tdim,cells.clone());
  }

  public boolean is_mixed() { return _cells!=null; }
  public int num_cells() { return _cells==null ? 1 : _cells.length; }
  public Cell cell( int i ) { return _cells==null ? this : _cells[i]; }

  public Tup hash_data() {
    if( _cells==null ) return Tup.make("Cell",_name,_tdim);
    Object[] cs = new Object[_cells.length];
    for( int i=0; i<cs.length; i++ ) cs[i] = _cells[i].hash_data();
    return Tup.make("MixedCell",cs);
  }

  @Override public boolean equals( Object o ) {
    if( this==o ) return true;
    return o instanceof Cell c && _tdim==c._tdim && _name.equals(c._name) && Arrays.equals(_cells,c._cells);
  }
  @Override public int hashCode() { return _name.hashCode()*31+_tdim; }
  @Override public String toString() { return _name; }
}
