package com.cliffc.wf.sig;

import com.cliffc.wf.FormErr;
import com.cliffc.wf.Forms;
import com.cliffc.wf.index.Index;
import com.cliffc.wf.node.*;
import com.cliffc.wf.space.*;
import org.junit.Test;

import static org.junit.Assert.*;

public class TestSignature {
  private final FiniteElement _p1 = new FiniteElement("Lagrange",Cell.TRIANGLE,1);
  private final FunctionSpace _V = new FunctionSpace(_p1);

  // Same space, both renumbered to 0: same data whatever the raw counts
  @Test public void testRenumberedEqual() {
    Coefficient a = new Coefficient(_V,3), b = new Coefficient(_V,17);
    Tup da = a.signature_data(new Renumbering().put(a,0));
    Tup db = b.signature_data(new Renumbering().put(b,0));
    assertEquals(da,db);
    assertEquals("('Coefficient', 0, null, null, ('FunctionSpace', null, ('FiniteElement', 'Lagrange', ('Cell', 'triangle', 2), 1, ())))",da.toString());
    assertNotEquals(da,a.signature_data(new Renumbering().put(a,1)));
  }

  @Test public void testMissingNumber() {
    Coefficient a = new Coefficient(_V,3);
    try {
      a.signature_data(new Renumbering());
      fail();
    } catch( FormErr e ) {
      assertEquals(FormErr.Level.Query,e._lvl);
    }
  }

  // Expressions built in different contexts fingerprint the same
  @Test public void testCompute() {
    String s0 = Signature.compute(build(new Forms(2)));
    Forms f = new Forms(2);
    f.coefficient(_V,40);        // Burn some counts
    f.index(25);
    f.label(9);
    f.mesh(Cell.TETRAHEDRON);
    String s1 = Signature.compute(build(f));
    assertEquals(64,s0.length());
    assertTrue(s0.matches("[0-9a-f]+"));
    assertEquals(s0,s1);
  }
  private static Node build( Forms f ) {
    Mesh m = f.default_domain(Cell.TRIANGLE);
    Coefficient u = f.coefficient(new FunctionSpace(m,FiniteElement.vector("Lagrange",Cell.TRIANGLE,1)));
    Coefficient w = f.coefficient(new FunctionSpace(m,new FiniteElement("Lagrange",Cell.TRIANGLE,1)));
    Index i = f.index(), j = f.index();
    Node ui = Forms.indexed(u,i);
    Node x = Forms.product(f.dx(ui,j),f.dx(Forms.indexed(u,j),i));
    return Forms.sum(x,Forms.product(w,f.variable(Forms.product(ui,ui))));
  }

  // Swapping which coefficient is used where changes the signature
  @Test public void testStructure() {
    Forms f = new Forms();
    Coefficient a = f.coefficient(_V), b = f.coefficient(_V);
    Node ab = Forms.product(a,Forms.sum(a,b));
    Node ba = Forms.product(b,Forms.sum(a,b));
    assertNotEquals(Signature.compute(ab),Signature.compute(ba));
    assertEquals(Signature.compute(ab),Signature.compute(Forms.product(b,Forms.sum(b,a))));
    assertNotEquals(Signature.compute(ab),Signature.compute(Forms.sum(a,Forms.sum(a,b))));
    assertNotEquals(Signature.compute(a),Signature.compute(Forms.scalar(1)));
  }

  // Indices are numbered by first use
  @Test public void testIndexRenumbering() {
    Forms f = new Forms(2);
    Coefficient u = f.coefficient(FiniteElement.vector("Lagrange",Cell.TRIANGLE,1));
    Index i = f.index(), j = f.index();
    Node a = f.dx(Forms.indexed(u,i),i);
    Node b = f.dx(Forms.indexed(u,j),j);
    assertNotEquals(a,b);
    assertEquals(Signature.compute(a),Signature.compute(b));
    Renumbering r = Renumbering.of(a);
    Tup t = a.signature_data(r);
    assertEquals(Tup.make("MultiIndex",new Object[]{Tup.make("Index",0)}),t.at(3));
  }

  // Shared operands produce one data object
  @Test public void testShared() {
    Coefficient a = new Coefficient(_V,0);
    Node p = Forms.product(a,a);
    Tup t = Forms.sum(p,p).signature_data(Renumbering.of(p));
    assertEquals("Sum",t.at(0));
    assertSame(t.at(1),t.at(2));
  }

  // First appearance order: coefficients and their parents, labels, domains
  @Test public void testRenumberingOf() {
    Forms f = new Forms();
    Mesh m = f.mesh(Cell.TRIANGLE), n = f.mesh(Cell.TRIANGLE);
    Coefficient a = f.coefficient(new FunctionSpace(n,_p1));
    Coefficient parent = f.coefficient(new FunctionSpace(m,_p1));
    Coefficient b = new Coefficient(new FunctionSpace(m,_p1),f.coefficient(_V).count(),1,parent);
    Label l = f.label();
    Node e = Forms.sum(b,new Variable(a,l));
    Renumbering r = Renumbering.of(e);
    assertEquals(0,r.at(b));
    assertEquals(1,r.at(parent));
    assertEquals(2,r.at(a));
    assertEquals(0,r.at(l));
    assertEquals(0,r.at(m));
    assertEquals(1,r.at(n));
    // Part and parent take part in the data
    Tup tb = b.signature_data(r);
    assertEquals(1,tb.at(2));
    assertEquals(1,tb.at(3));
  }

  // Labels left out keep their raw count
  @Test public void testLabelFallback() {
    Label l = new Label(42);
    assertEquals(Tup.make("Label",42),l.signature_data(new Renumbering()));
    assertEquals(Tup.make("Label",0),l.signature_data(new Renumbering().put(l,0)));
  }

  // Payloads show up in the data
  @Test public void testPayload() {
    Forms f = new Forms(3);
    Coefficient a = f.coefficient(_p1);
    assertNotEquals(Signature.compute(f.grad(a)),Signature.compute(new Forms(2).grad(a)));
    assertNotEquals(Signature.compute(Forms.transformed(Forms.reference_value(a),Forms.transform_op("x"))),
                    Signature.compute(Forms.transformed(Forms.reference_value(a),Forms.transform_op("y"))));
    assertEquals(Tup.make("ScalarValue",2.5),Forms.scalar(2.5).signature_data(new Renumbering()));
  }

  // Names are quoted with escapes, so one name can't pass for several entries
  @Test public void testQuotedNames() {
    TransformOp op = Forms.transform_op("a'), ('TransformOp', 'b");
    assertEquals("('TransformOp', 'a\\'), (\\'TransformOp\\', \\'b')",op.signature_data(new Renumbering()).toString());
    assertEquals("('TransformOp', 'x\\\\')",Forms.transform_op("x\\").signature_data(new Renumbering()).toString());
    assertNotEquals(Signature.compute(Forms.transformed(Forms.scalar(1),Forms.transform_op("a'"))),
                    Signature.compute(Forms.transformed(Forms.scalar(1),Forms.transform_op("a\\'"))));
  }

  @Test public void testDualSpace() {
    Coefficient a = new Coefficient(_V,0), b = new Coefficient(_V.dual(),0);
    Renumbering ra = new Renumbering().put(a,0), rb = new Renumbering().put(b,0);
    assertNotEquals(a.signature_data(ra),b.signature_data(rb));
    assertEquals("DualSpace",((Tup)b.signature_data(rb).at(4)).at(0));
  }
}
