package com.cliffc.wf;

import com.cliffc.wf.index.Index;
import com.cliffc.wf.node.*;
import com.cliffc.wf.space.Cell;
import com.cliffc.wf.space.Domain;
import com.cliffc.wf.space.Mesh;
import org.junit.Rule;
import org.junit.Test;
import org.junit.contrib.java.lang.system.SystemErrRule;

import static org.junit.Assert.*;

public class TestForms {
  @Rule public final SystemErrRule sysErr = new SystemErrRule().enableLog().muteForSuccessfulTests();

  @Test public void testDim() {
    assertEquals(WF.DEFAULT_DIM,new Forms().dim());
    assertEquals(2,new Forms(2).dim());
    try {
      new Forms(0);
      fail();
    } catch( FormErr e ) {
      assertEquals(FormErr.Level.Construct,e._lvl);
      assertEquals("Construct: Forms: Spatial dimension must be positive, got 0",e.toString());
    }
  }

  @Test public void testCounters() {
    Forms f = new Forms();
    assertEquals(0,f.label().count());
    assertEquals(1,f.label().count());
    assertEquals(5,f.label(5).count());
    assertEquals(6,f.label().count());
    Index i = f.index();
    assertEquals(0,i.count());
    Index[] jk = f.indices(2);
    assertEquals(1,jk[0].count());
    assertEquals(2,jk[1].count());
    assertEquals(7,f.index(7).count());
    assertEquals(8,f.index().count());
    assertEquals(0,f.mesh(Cell.TRIANGLE).count());
  }

  // One default domain per cell, per context
  @Test public void testDefaultDomain() {
    Forms f = new Forms();
    Mesh tri = f.default_domain(Cell.TRIANGLE);
    assertSame(tri,f.default_domain(Cell.TRIANGLE));
    assertNotSame(tri,f.default_domain(Cell.INTERVAL));
    assertEquals(tri,new Forms().default_domain(Cell.TRIANGLE));
    Domain[] ds = f.default_domains(Cell.mixed(Cell.INTERVAL,Cell.TRIANGLE));
    assertSame(tri,ds[1]);
    assertThrows(FormErr.class,() -> f.default_domain(Cell.mixed(Cell.TRIANGLE)));
  }

  // Counters are atomic; concurrent users never see a duplicate
  @Test public void testThreads() throws InterruptedException {
    Forms f = new Forms();
    int n = 4, per = 1000;
    boolean[] seen = new boolean[n*per];
    Thread[] ts = new Thread[n];
    for( int t=0; t<n; t++ )
      ts[t] = new Thread(() -> {
          for( int k=0; k<per; k++ ) {
            int c = f.index().count();
            synchronized( seen ) { assertFalse(seen[c]); seen[c]=true; }
          }
      });
    for( Thread t : ts ) t.start();
    for( Thread t : ts ) t.join();
    for( boolean b : seen ) assertTrue(b);
  }

  @Test public void testDebugPrint() {
    boolean debug = WF.DEBUG;
    try {
      WF.DEBUG = false;
      assertEquals(3,(int)WF.p(3,"quiet"));
      WF.DEBUG = true;
      Node s = WF.p(Forms.scalar(1),"loud");
      assertEquals(Op.ScalarValue,s._op);
    } finally {
      WF.DEBUG = debug;
    }
    assertEquals("loud\n",sysErr.getLog().replace("\r",""));
  }
}
