package com.cliffc.wf;

import com.cliffc.wf.node.Node;
import com.cliffc.wf.util.SB;

// Fatal errors.  Nothing here is recoverable: the computation is
// deterministic, so the caller gets either a whole result or one of these.
public class FormErr extends RuntimeException {

  // Error levels
  public enum Level {
    Construct,                // Invariant violated building a node or space
    Traverse,                 // Structural violation found walking a DAG
    Query,                    // Ambiguous or missing answer from an accessor
  }

  public final Level _lvl;    // Where it was found
  public FormErr(Level lvl, String msg) { super(msg); _lvl=lvl; }

  public static FormErr construct(String msg) { return new FormErr(Level.Construct,msg); }
  public static FormErr construct(String op, String msg) {
    return new FormErr(Level.Construct,new SB().p(op).p(": ").p(msg).toString());
  }
  public static FormErr traverse(String msg) { return new FormErr(Level.Traverse,msg); }
  public static FormErr unhandled(Node n, Object rules) {
    SB sb = new SB().p("Unhandled node kind ").p(n._op.name()).p(" in ").p(rules.toString());
    return new FormErr(Level.Traverse,sb.toString());
  }
  public static FormErr query(String msg) { return new FormErr(Level.Query,msg); }

  @Override public String toString() { return _lvl+": "+getMessage(); }
}
