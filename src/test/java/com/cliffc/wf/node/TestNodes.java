package com.cliffc.wf.node;

import com.cliffc.wf.FormErr;
import com.cliffc.wf.Forms;
import com.cliffc.wf.index.Index;
import com.cliffc.wf.space.Cell;
import com.cliffc.wf.space.FiniteElement;
import org.junit.Test;

import static org.junit.Assert.*;

public class TestNodes {
  private final Forms _forms = new Forms(2);
  private final Coefficient _s = _forms.coefficient(new FiniteElement("Lagrange",Cell.TRIANGLE,1));
  private final Coefficient _v = _forms.coefficient(FiniteElement.vector("Lagrange",Cell.TRIANGLE,1));
  private final Coefficient _m = _forms.coefficient(new FiniteElement("Lagrange",Cell.TRIANGLE,1,2,2));

  @Test public void testTerminals() {
    assertTrue(_s.is_terminal());
    assertEquals(0,_s.len());
    assertEquals(0,_s.rank());
    assertFalse(Forms.sum(_s,_s).is_terminal());
    assertTrue(Forms.scalar(1).is_terminal());
    assertTrue(Forms.multi_index(0,_forms.index()).is_terminal());
    assertThrows(RuntimeException.class,() -> _s.reconstruct(Node.NO_OPS));
  }

  // Structural equality, hash cached at construction
  @Test public void testEquals() {
    Node a = Forms.sum(_s,Forms.scalar(2));
    Node b = Forms.sum(_s,Forms.scalar(2));
    assertNotSame(a,b);
    assertEquals(a,b);
    assertEquals(a.hashCode(),b.hashCode());
    assertNotEquals(a,Forms.sum(_s,Forms.scalar(3)));
    assertNotEquals(a,Forms.product(_s,Forms.scalar(2)));
  }

  @Test public void testSum() {
    assertArrayEquals(new int[]{2},Forms.sum(_v,_v).shape());
    try {
      Forms.sum(_s,_v);
      fail();
    } catch( FormErr e ) {
      assertEquals("Sum: Can't add expressions with different shapes.",e.getMessage());
    }
    Index i = _forms.index(), j = _forms.index();
    assertThrows(FormErr.class,() -> Forms.sum(Forms.indexed(_v,i),Forms.indexed(_v,j)));
    // Free index order may differ
    Node mij = Forms.indexed(_m,i,j), mji = Forms.indexed(_m,j,i);
    assertArrayEquals(new Index[]{i,j},Forms.sum(mij,mji).free_indices());
  }

  @Test public void testProduct() {
    Index i = _forms.index();
    Product p = Forms.product(Forms.indexed(_v,i),Forms.indexed(_v,i));
    assertFalse(p.has_free());
    assertArrayEquals(new Index[]{i},p.repeated_indices());
    assertThrows(FormErr.class,() -> Forms.product(_v,_s));
    Index j = _forms.index();
    Product q = Forms.product(Forms.indexed(_v,i),Forms.indexed(_v,j));
    assertArrayEquals(new Index[]{i,j},q.free_indices());
  }

  @Test public void testIndexed() {
    Index i = _forms.index(), j = _forms.index();
    Indexed mij = Forms.indexed(_m,i,j);
    assertEquals(0,mij.rank());
    assertArrayEquals(new Index[]{i,j},mij.free_indices());
    assertArrayEquals(new int[]{2,2},mij.index_dims());
    // Trace
    assertFalse(Forms.indexed(_m,i,i).has_free());
    // Fixed components
    assertEquals(0,Forms.indexed(_m,0,1).free_indices().length);
    assertThrows(FormErr.class,() -> Forms.indexed(_m,0,2));
    assertThrows(FormErr.class,() -> Forms.indexed(_m,i));
    assertThrows(FormErr.class,() -> Forms.indexed(_s,i));
    assertEquals("w_2[(i_0,i_1)]",mij.toString());
  }

  @Test public void testComponentTensor() {
    Index i = _forms.index(), j = _forms.index();
    Node mij = Forms.indexed(_m,i,j);
    ComponentTensor mt = Forms.as_tensor(mij,j,i); // Transpose
    assertArrayEquals(new int[]{2,2},mt.shape());
    assertFalse(mt.has_free());
    ComponentTensor row = Forms.as_tensor(mij,j);
    assertArrayEquals(new int[]{2},row.shape());
    assertArrayEquals(new Index[]{i},row.free_indices());
    Index k = _forms.index();
    assertThrows(FormErr.class,() -> Forms.as_tensor(mij,k));
    assertThrows(FormErr.class,() -> Forms.as_tensor(mij,i,i));
    assertThrows(FormErr.class,() -> Forms.as_tensor(_v,i));
  }

  @Test public void testVariable() {
    Label l = _forms.label();
    Variable x = new Variable(_v,l);
    Variable y = new Variable(Forms.sum(_v,_v),new Label(l.count()));
    assertArrayEquals(new int[]{2},x.shape());
    // Equal by label alone
    assertEquals(x,y);
    assertEquals(x.hashCode(),y.hashCode());
    assertNotEquals(x,_forms.variable(_v));
    assertThrows(FormErr.class,() -> new Variable(_v,_s));
    Index i = _forms.index();
    assertArrayEquals(new Index[]{i},_forms.variable(Forms.indexed(_v,i)).free_indices());
  }

  @Test public void testTransformed() {
    TransformOp op = Forms.transform_op("f");
    Transformed t = Forms.transformed(Forms.reference_value(_v),op);
    assertArrayEquals(new int[]{2},t.shape());
    assertThrows(FormErr.class,() -> new Transformed(_v,_s));
    assertEquals(t,t.reconstruct(t.operands()));
  }

  @Test public void testMultiIndex() {
    Index i = _forms.index();
    MultiIndex a = Forms.multi_index(i,1), b = Forms.multi_index(new Index(i.count()),1);
    assertEquals(a,b);
    assertEquals(2,a.size());
    assertTrue(a.at(1).is_fixed());
    assertThrows(FormErr.class,() -> Forms.multi_index("x"));
    assertEquals("(i_0,1)",a.toString());
  }
}
