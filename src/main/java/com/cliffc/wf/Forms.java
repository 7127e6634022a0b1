package com.cliffc.wf;

import com.cliffc.wf.index.FixedIndex;
import com.cliffc.wf.index.Idx;
import com.cliffc.wf.index.Index;
import com.cliffc.wf.node.*;
import com.cliffc.wf.space.*;
import com.cliffc.wf.util.Counter;
import org.jetbrains.annotations.NotNull;

import java.util.HashMap;

/** Construction context for expressions.
 *
 *  Owns the id allocators for every kind of counted entity (coefficients,
 *  labels, indices and meshes) and the default spatial dimension, so two
 *  contexts never share hidden global state.  The allocators are atomic; a
 *  context may be shared across threads.
 *
 *  Also keeps one default Mesh per cell, used when a Coefficient is built
 *  straight from an Element.
 */
public class Forms {
  public final int _dim;        // Spatial dimension for derivatives
  private final Counter _coefs  = new Counter();
  private final Counter _labels = new Counter();
  private final Counter _idxs   = new Counter();
  private final Counter _meshes = new Counter();
  private final HashMap<Cell,Mesh> _default_domains = new HashMap<>();

  public Forms() { this(WF.DEFAULT_DIM); }
  public Forms( int dim ) {
    if( dim < 1 ) throw FormErr.construct("Forms","Spatial dimension must be positive, got "+dim);
    _dim = dim;
  }
  public int dim() { return _dim; }

  // --------------------------------------------------------------------------
  // Domains
  public Mesh mesh( @NotNull Cell cell ) { return new Mesh(cell,_meshes.next()); }
  public Mesh mesh( @NotNull Cell cell, int gdim ) { return new Mesh(cell,_meshes.next(),gdim); }

  // The default domain for a cell, made once per context
  public synchronized Mesh default_domain( @NotNull Cell cell ) {
    if( cell.is_mixed() ) throw FormErr.construct("default_domain","Mixed cell "+cell+" has a tuple of default domains");
    return _default_domains.computeIfAbsent(cell,this::mesh);
  }
  // One default domain per sub-cell of a mixed cell
  public Domain[] default_domains( @NotNull Cell cell ) {
    Domain[] ds = new Domain[cell.num_cells()];
    for( int i=0; i<ds.length; i++ ) ds[i] = default_domain(cell.cell(i));
    return ds;
  }

  // --------------------------------------------------------------------------
  // Form arguments
  public Coefficient coefficient( @NotNull AbstractFunctionSpace space ) { return new Coefficient(space,_coefs.next()); }
  public Coefficient coefficient( @NotNull AbstractFunctionSpace space, Integer count ) {
    return new Coefficient(space,_coefs.claim(count));
  }
  // Legacy path: an Element alone, placed on the default domain of its cell
  public Coefficient coefficient( @NotNull Element element ) { return coefficient(element,null); }
  public Coefficient coefficient( @NotNull Element element, Integer count ) {
    Cell cell = element.cell();
    FunctionSpace space = cell.is_mixed()
      ? new FunctionSpace(default_domains(cell),element)
      : new FunctionSpace(default_domain(cell),element);
    return coefficient(space,count);
  }
  // One coefficient per sub-space of a mixed space, else just the one
  public Coefficient[] coefficients( @NotNull AbstractFunctionSpace space ) {
    if( !(space instanceof MixedFunctionSpace mfs) )
      return new Coefficient[]{coefficient(space)};
    Coefficient[] cs = new Coefficient[mfs.num_sub_spaces()];
    for( int i=0; i<cs.length; i++ ) cs[i] = coefficient(mfs.ufl_sub_space(i));
    return cs;
  }

  public Label label() { return new Label(_labels.next()); }
  public Label label( Integer count ) { return new Label(_labels.claim(count)); }
  public Variable variable( Node expr ) { return new Variable(expr,label()); }

  // --------------------------------------------------------------------------
  // Indices
  public Index index() { return new Index(_idxs.next()); }
  public Index index( Integer count ) { return new Index(_idxs.claim(count)); }
  public Index[] indices( int n ) {
    Index[] ids = new Index[n];
    for( int i=0; i<n; i++ ) ids[i] = index();
    return ids;
  }
  // Ints become FixedIndex, Idx pass through
  public static MultiIndex multi_index( Object... ids ) {
    Idx[] xs = new Idx[ids.length];
    for( int i=0; i<ids.length; i++ ) {
      Object o = ids[i];
      if( o instanceof Idx x ) xs[i] = x;
      else if( o instanceof Integer v ) xs[i] = new FixedIndex(v);
      else throw FormErr.construct("MultiIndex","Expecting an index or int, got "+o);
    }
    return new MultiIndex(xs);
  }

  // --------------------------------------------------------------------------
  // Algebra
  public static ScalarValue scalar( double d ) { return new ScalarValue(d); }
  public static Sum sum( Node a, Node b ) { return new Sum(a,b); }
  public static Product product( Node a, Node b ) { return new Product(a,b); }
  public static Indexed indexed( Node a, Object... ids ) { return new Indexed(a,multi_index(ids)); }
  public static ComponentTensor as_tensor( Node expr, Index... ids ) { return new ComponentTensor(expr,new MultiIndex(ids)); }
  public static ReferenceValue reference_value( Node f ) { return new ReferenceValue(f); }
  public static TransformOp transform_op( String name ) { return new TransformOp(name); }
  public static Transformed transformed( Node expr, TransformOp op ) { return new Transformed(expr,op); }

  // --------------------------------------------------------------------------
  // Derivatives, over this context's spatial dimension
  public SpatialDerivative dx( Node f, Object... ids ) { return new SpatialDerivative(f,multi_index(ids),_dim); }
  public static Diff diff( Node f, Variable x ) { return new Diff(f,x); }
  public Grad grad( Node f ) { return new Grad(f,_dim); }
  public static Div div( Node f ) { return new Div(f); }
  public Curl curl( Node f ) { return new Curl(f,_dim); }
  public static Rot rot( Node f ) { return new Rot(f); }

  @Override public String toString() {
    return "Forms(dim="+_dim+", coefficients "+_coefs+", labels "+_labels+", indices "+_idxs+", meshes "+_meshes+")";
  }
}
