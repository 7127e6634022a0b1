package com.cliffc.wf.dag;

import com.cliffc.wf.node.Node;
import com.cliffc.wf.node.Op;
import com.cliffc.wf.util.Ary;

import java.util.Arrays;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;

// DAG walks.  Iterative with an explicit stack, so deep expressions do not
// blow the Java stack.  "Unique" is by object identity.
public abstract class Traversal {
  private static final Predicate<Node> NO_CUTOFF = n -> false;

  public static Ary<Node> unique_post_order( Node root ) { return unique_post_order(List.of(root),NO_CUTOFF); }

  // Every distinct node reachable from the roots exactly once, operands
  // before users.  Nodes matching cutoff are visited but not entered.
  public static Ary<Node> unique_post_order( List<Node> roots, Predicate<Node> cutoff ) {
    Ary<Node> post  = new Ary<>(Node.class);
    Ary<Node> stack = new Ary<>(Node.class);
    int[] pos = new int[8];     // Next operand to visit, parallel to stack
    Set<Node> visit = Collections.newSetFromMap(new IdentityHashMap<>());
    for( Node root : roots ) {
      if( !visit.add(root) ) continue;
      stack.push(root); pos[0]=0;
      while( !stack.isEmpty() ) {
        int top = stack._len-1;
        Node n = stack.last();
        if( pos[top] < n.len() && !cutoff.test(n) ) {
          Node x = n.in(pos[top]++);
          if( visit.add(x) ) {
            if( stack._len == pos.length ) pos = Arrays.copyOf(pos,pos.length<<1);
            pos[stack._len] = 0;
            stack.push(x);
          }
        } else
          post.push(stack.pop());
      }
    }
    return post;
  }

  // Distinct nodes of one kind, in post order
  public static Ary<Node> unique_nodes( Node root, Op op ) {
    Ary<Node> ns = new Ary<>(Node.class);
    for( Node n : unique_post_order(root) )
      if( n._op==op )
        ns.push(n);
    return ns;
  }
}
