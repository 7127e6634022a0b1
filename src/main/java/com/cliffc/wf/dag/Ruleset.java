package com.cliffc.wf.dag;

import com.cliffc.wf.FormErr;
import com.cliffc.wf.node.Node;
import com.cliffc.wf.node.Op;

import java.lang.reflect.Array;

/** A dispatch table from node kind to rule, for use with {@link MapDag}.
 *
 *  A rule sees the node and the already-computed results for its operands,
 *  and returns the result for the node.  Lookup is exact kind first, then
 *  the terminal or compound family default.  A kind with neither is an
 *  error when met.
 *
 *  Kinds marked as cutoff have their operands skipped by the traversal; the
 *  rule sees an empty operand-result array and handles the whole subtree.
 */
public final class Ruleset<R> {
  @FunctionalInterface
  public interface Rule<R> { R apply( Node n, R[] ops ); }

  // Terminal-passthrough
  public static final Rule<Node> TERMINAL = (n,ops) -> n;
  // Reuse-if-untouched; a cutoff node sees no operand results and is kept
  public static final Rule<Node> REUSE = (n,ops) -> ops.length==0 ? n : n.reuse_if_untouched(ops);

  public final String _name;
  private final Class<R> _clz;  // Result arrays are made with this
  private final Rule<R>[] _rules;
  private Rule<R> _terms, _comps;
  private final boolean[] _cutoff = new boolean[Op.VALS.length];

  @SuppressWarnings("unchecked")
  public Ruleset( String name, Class<R> clz ) {
    _name = name;
    _clz = clz;
    _rules = (Rule<R>[])new Rule[Op.VALS.length];
  }

  // A Node-to-Node rewriter: terminals pass through, compounds are reused
  // when untouched.  Add specific rules with on().
  public static Ruleset<Node> rewriter( String name ) {
    return new Ruleset<>(name,Node.class).terminals(TERMINAL).compounds(REUSE);
  }

  public Ruleset<R> on( Op op, Rule<R> rule ) { _rules[op.ordinal()] = rule; return this; }
  public Ruleset<R> terminals( Rule<R> rule ) { _terms = rule; return this; }
  public Ruleset<R> compounds( Rule<R> rule ) { _comps = rule; return this; }
  public Ruleset<R> cutoff( Op... ops ) {
    for( Op op : ops ) _cutoff[op.ordinal()] = true;
    return this;
  }
  public boolean is_cutoff( Node n ) { return _cutoff[n._op.ordinal()]; }

  public Rule<R> rule( Op op ) {
    Rule<R> r = _rules[op.ordinal()];
    return r != null ? r : (op._terminal ? _terms : _comps);
  }

  public R apply( Node n, R[] ops ) {
    Rule<R> r = rule(n._op);
    if( r==null ) throw FormErr.unhandled(n,this);
    return r.apply(n,ops);
  }

  @SuppressWarnings("unchecked")
  R[] results( int len ) { return (R[])Array.newInstance(_clz,len); }

  @Override public String toString() { return _name; }
}
