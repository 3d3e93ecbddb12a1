package edu.cmu.cs.cs15745.heapviz.output;

import org.junit.Assert;
import org.junit.Test;

public class TestEscaping {

  @Test
  public void test1() {
    Assert.assertEquals("ExPDy", Escaping.strip("&x+$y"));
    Assert.assertEquals("HGBDg", Escaping.strip("#GB$g"));
    Assert.assertEquals("fBaMbB", Escaping.strip("f(a-b)"));
    Assert.assertEquals("AA", Escaping.strip("@@"));
    Assert.assertEquals("plain_name", Escaping.strip("plain_name"));
  }

  @Test
  public void test2() {
    for (String text : new String[] { "&x", "a+b+c", "$$", "(x)", "" }) {
      String once = Escaping.strip(text);
      Assert.assertEquals(once, Escaping.strip(once));
    }
  }

  @Test
  public void test3() {
    Assert.assertEquals("next.val", Escaping.portName("next.val"));
    Assert.assertEquals("data[0]", Escaping.portName("data[0]"));
    Assert.assertEquals("Ex", Escaping.portName("&x"));
  }

  @Test
  public void test4() {
    try {
      Escaping.portName("a|b");
      Assert.fail();
    } catch (EscapingException e) {
      Assert.assertEquals("a|b", e.text());
      Assert.assertEquals(1, e.index());
    }
  }

  @Test(expected = EscapingException.class)
  public void test5() {
    Escaping.portName("line\nbreak");
  }

  @Test
  public void test6() {
    Assert.assertEquals("a\\{b\\}\\n", Escaping.dotLabel("a{b}\n"));
    Assert.assertEquals("x \\| y", Escaping.dotLabel("x | y"));
    Assert.assertEquals("\\\"q\\\"", Escaping.dotLabel("\"q\""));
    Assert.assertEquals("Ex = 0", Escaping.dotLabel("&x = 0"));
  }

  @Test
  public void test7() {
    Assert.assertEquals("a\\nb\\nc", Escaping.dotLabel("a\r\nb\rc"));
    Assert.assertEquals("a\tb", Escaping.dotLabel("a\tb"));
    try {
      Escaping.dotLabel("x\u0001y");
      Assert.fail();
    } catch (EscapingException e) {
      Assert.assertEquals(1, e.index());
    }
  }

  @Test(expected = EscapingException.class)
  public void test8() {
    Escaping.dotLabel("bad\uD800");
  }

  @Test
  public void test9() {
    Assert.assertEquals("Ex\t\r\n", Escaping.xmlText("&x\t\r\n"));
    Assert.assertEquals("a\uD83D\uDE00", Escaping.xmlText("a\uD83D\uDE00"));
    for (String text : new String[] { "a\u0000", "\u001Fb", "x\uFFFE", "\uDC00", "y\uD800z" }) {
      try {
        Escaping.xmlText(text);
        Assert.fail(text);
      } catch (EscapingException e) {
        Assert.assertEquals(text, e.text());
      }
    }
  }
}
