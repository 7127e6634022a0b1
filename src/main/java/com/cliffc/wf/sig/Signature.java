package com.cliffc.wf.sig;

import com.cliffc.wf.dag.MapDag;
import com.cliffc.wf.dag.Ruleset;
import com.cliffc.wf.node.Node;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.List;

// Canonical fingerprints of expressions.  Equal signatures mean the
// expressions agree up to the numbering of their counted entities.
public abstract class Signature {

  // Signature data for a whole DAG; shared operands computed once
  public static Tup data( Node expr, Renumbering r ) {
    return MapDag.map_expr_dag(rules(r),expr);
  }
  public static List<Tup> data( List<Node> exprs, Renumbering r ) {
    return MapDag.map_expr_dags(rules(r),exprs);
  }
  private static Ruleset<Tup> rules( Renumbering r ) {
    Ruleset.Rule<Tup> rule = (n,ops) -> n.signature_data(r,ops);
    return new Ruleset<>("signature",Tup.class).terminals(rule).compounds(rule);
  }

  // Hex SHA-256 of the signature data of the roots, renumbered by first
  // appearance
  public static String compute( Node... exprs ) {
    Renumbering r = Renumbering.of(exprs);
    Tup t = Tup.make(data(Arrays.asList(exprs),r).toArray());
    return sha256(t.toString());
  }

  static String sha256( String s ) {
    MessageDigest md;
    try { md = MessageDigest.getInstance("SHA-256"); }
    catch( NoSuchAlgorithmException e ) { throw new IllegalStateException(e); }
    byte[] bs = md.digest(s.getBytes(StandardCharsets.UTF_8));
    StringBuilder sb = new StringBuilder(bs.length*2);
    for( byte b : bs ) sb.append(Character.forDigit((b>>4)&0xF,16)).append(Character.forDigit(b&0xF,16));
    return sb.toString();
  }
}
