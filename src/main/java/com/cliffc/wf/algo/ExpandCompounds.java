package com.cliffc.wf.algo;

import com.cliffc.wf.Forms;
import com.cliffc.wf.dag.MapDag;
import com.cliffc.wf.dag.Ruleset;
import com.cliffc.wf.node.CompoundDerivative;
import com.cliffc.wf.node.Node;
import com.cliffc.wf.node.Op;

// Lower Grad and Div into index notation: Indexed, SpatialDerivative and
// ComponentTensor over fresh indices from the Forms context.  Curl and Rot
// have no lowering and fail if met.
public abstract class ExpandCompounds {
  public static Node expand_compounds( Forms forms, Node expr ) {
    Ruleset.Rule<Node> lower = (n,ops) -> ((CompoundDerivative)n).as_basic(forms,ops[0]);
    Ruleset<Node> rules = Ruleset.rewriter("expand_compounds")
      .on(Op.Grad,lower)
      .on(Op.Div ,lower)
      .on(Op.Curl,lower)
      .on(Op.Rot ,lower);
    return MapDag.map_expr_dag(rules,expr);
  }
}
