package com.cliffc.wf.dag;

import com.cliffc.wf.WF;
import com.cliffc.wf.node.Node;
import com.cliffc.wf.util.Ary;
import com.cliffc.wf.util.SB;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;

/** Map a ruleset over an expression DAG.
 *
 *  Each distinct node (by identity) is handed to its rule exactly once, in
 *  post order, with the memoized results of its operands.  A node shared by
 *  many parents thus yields one result object seen by all of them, and the
 *  work is linear in the number of distinct nodes.  The memo lives for one
 *  call.
 *
 *  With compress set, a result equal to one produced earlier in the same call
 *  is replaced by that earlier object, restoring sharing between equal
 *  sub-results built from distinct inputs.
 *
 *  Errors thrown by a rule propagate unchanged.
 */
public abstract class MapDag {

  public static <R> R map_expr_dag( Ruleset<R> rules, Node expr ) { return map_expr_dag(rules,expr,false); }
  public static <R> R map_expr_dag( Ruleset<R> rules, Node expr, boolean compress ) {
    return map_expr_dags(rules,List.of(expr),compress).get(0);
  }
  public static <R> List<R> map_expr_dags( Ruleset<R> rules, List<Node> exprs ) { return map_expr_dags(rules,exprs,false); }

  // Several roots sharing one memo
  public static <R> List<R> map_expr_dags( Ruleset<R> rules, List<Node> exprs, boolean compress ) {
    IdentityHashMap<Node,R> memo = new IdentityHashMap<>();
    HashMap<R,R> canon = compress ? new HashMap<>() : null;
    Ary<Node> post = Traversal.unique_post_order(exprs,rules::is_cutoff);
    for( Node n : post ) {
      R[] ops;
      if( rules.is_cutoff(n) ) ops = rules.results(0);
      else {
        ops = rules.results(n.len());
        for( int i=0; i<ops.length; i++ ) {
          assert memo.containsKey(n.in(i)); // Post order
          ops[i] = memo.get(n.in(i));
        }
      }
      R r = rules.apply(n,ops);
      if( canon != null && r != null ) {
        R old = canon.putIfAbsent(r,r);
        if( old != null ) r = old;
      }
      if( WF.trace() ) WF.p(r,trace(rules,n,r));
      memo.put(n,r);
    }
    List<R> rez = new ArrayList<>(exprs.size());
    for( Node e : exprs ) rez.add(memo.get(e));
    return rez;
  }

  private static String trace( Ruleset<?> rules, Node n, Object r ) {
    SB sb = new SB().p(rules._name).p(": ").p(n._op.name()).p(' ');
    n.str(sb).p(" -> ");
    return (r==n ? sb.p("same") : sb.pobj(r)).toString();
  }
}
