package com.cliffc.wf.algo;

import com.cliffc.wf.FormErr;
import com.cliffc.wf.dag.MapDag;
import com.cliffc.wf.dag.Ruleset;
import com.cliffc.wf.node.*;

import java.util.List;

/** Push every Transformed node down onto the reference values it covers.
 *
 *  {@code Transformed(A, op)} is replaced by A with each
 *  {@code ReferenceValue(f)} inside rewritten to
 *  {@code Transformed(ReferenceValue(f), op)}.  Everything else keeps its
 *  shape, and untouched sub-DAGs come back as the very same objects.
 *
 *  Nested transforms: the inner pass runs first and leaves
 *  {@code Transformed(ReferenceValue(f), inner)}; the outer pass then reaches
 *  the reference value through it, giving
 *  {@code Transformed(Transformed(ReferenceValue(f), outer), inner)}.
 *  Running the pass again on its own output changes nothing.
 */
public abstract class ApplyTransforms {
  private static final Ruleset<Node> OUTER = Ruleset.rewriter("apply_transforms")
    .on(Op.Transformed,(n,ops) -> is_pushed(n)
        ? n.reuse_if_untouched(ops) // Already on a reference value
        : MapDag.map_expr_dag(pusher(((Transformed)n).transform_op()),ops[0]));

  public static Node apply_transforms( Node expr ) { return MapDag.map_expr_dag(OUTER,expr); }
  public static List<Node> apply_transforms( List<Node> exprs ) { return MapDag.map_expr_dags(OUTER,exprs); }

  // Wraps reference values in Transformed nodes for one op
  static Ruleset<Node> pusher( TransformOp op ) {
    return Ruleset.rewriter("push "+op._name)
      .on(Op.ReferenceValue,(n,ops) -> {
          Node f = n.in(0);
          if( !f.is_terminal() || !(f instanceof FormArgument) )
            throw FormErr.traverse("Expecting a reference value of a form argument, got "+n);
          return new Transformed(n,op);
        });
  }

  // Transformed(...Transformed(ReferenceValue(f))...)
  static boolean is_pushed( Node n ) {
    while( n._op==Op.Transformed ) n = n.in(0);
    return n._op==Op.ReferenceValue && n.in(0) instanceof FormArgument;
  }
}
