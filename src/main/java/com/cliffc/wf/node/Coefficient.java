package com.cliffc.wf.node;

import com.cliffc.wf.FormErr;
import com.cliffc.wf.sig.Renumbering;
import com.cliffc.wf.sig.Tup;
import com.cliffc.wf.space.AbstractFunctionSpace;
import com.cliffc.wf.space.Domain;
import com.cliffc.wf.space.Element;
import com.cliffc.wf.util.SB;
import org.jetbrains.annotations.NotNull;

/** A known or unknown field of a form.
 *
 *  Identity is the count together with the function space.  The optional
 *  part (sub-space position) and parent (the coefficient this one was taken
 *  from) are bookkeeping only and do not take part in equality; they do take
 *  part in signature data.
 */
public final class Coefficient extends Terminal implements FormArgument {
  private final AbstractFunctionSpace _space;
  private final int _count;
  private final Integer _part;      // Sub-space position, or null
  private final Coefficient _parent;// Not owned; never forms a cycle

  public Coefficient( @NotNull AbstractFunctionSpace space, int count ) { this(space,count,null,null); }
  public Coefficient( @NotNull AbstractFunctionSpace space, int count, Integer part, Coefficient parent ) {
    super(Op.Coefficient);
    if( space==null ) throw FormErr.construct("Coefficient","Expecting a FunctionSpace or FiniteElement.");
    _space = space;
    _count = count;
    _part = part;
    _parent = parent;
    _shape = space.ufl_element().value_shape(); // Fails if the space has no single element
    init();
  }

  @Override public int count() { return _count; }
  public Integer part() { return _part; }
  public Coefficient parent() { return _parent; }
  @Override public AbstractFunctionSpace ufl_function_space() { return _space; }
  public Domain ufl_domain() { return _space.ufl_domain(); }
  public Domain[] ufl_domains() { return _space.ufl_domains(); }
  public Element ufl_element() { return _space.ufl_element(); }
  public boolean is_cellwise_constant() { return ufl_element().is_cellwise_constant(); }
  public boolean mixed() { return _space.mixed(); }

  @Override int payload_hash() { return _count*31 + _space.hashCode(); }
  @Override boolean eq_payload( Node n ) {
    Coefficient c = (Coefficient)n;
    return _count==c._count && _space.equals(c._space);
  }

  // Depends on the renumbered form arguments and domains
  @Override public Tup signature_data( Renumbering r, Tup[] ops ) {
    Integer parent = _parent==null ? null : r.at(_parent);
    return Tup.make("Coefficient",r.at(this),_part,parent,_space.signature_data(r));
  }

  @Override public SB str( SB sb ) {
    return _count < 10 ? sb.p("w_").p(_count) : sb.p("w_{").p(_count).p('}');
  }
}
