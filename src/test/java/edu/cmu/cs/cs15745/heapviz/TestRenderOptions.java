package edu.cmu.cs.cs15745.heapviz;

import java.util.Properties;

import org.junit.Assert;
import org.junit.Test;

import edu.cmu.cs.cs15745.heapviz.graph.HeapGraph;
import edu.cmu.cs.cs15745.heapviz.heap.Proposition;

public class TestRenderOptions {

	@Test
	public void testDefaults() {
		var options = RenderOptions.DEFAULTS;
		Assert.assertTrue(options.pruneSpecPlaceholders());
		Assert.assertTrue(options.prettyXml());
		Assert.assertFalse(options.showStack(HeapGraph.Kind.HEAP));
		Assert.assertTrue(options.showStack(HeapGraph.Kind.PRE));
		Assert.assertTrue(options.showStack(HeapGraph.Kind.POST));
	}

	@Test
	public void testFromProperties() {
		var properties = new Properties();
		properties.setProperty(RenderOptions.PRUNE_KEY, "false");
		properties.setProperty(RenderOptions.STACK_KEY, " Always ");
		properties.setProperty(RenderOptions.PRETTY_XML_KEY, "false");
		var options = RenderOptions.fromProperties(properties);
		Assert.assertFalse(options.pruneSpecPlaceholders());
		Assert.assertFalse(options.prettyXml());
		Assert.assertEquals(RenderOptions.StackDisplay.ALWAYS, options.stackDisplay());
		Assert.assertTrue(options.showStack(HeapGraph.Kind.HEAP));
	}

	@Test
	public void testMissingKeysKeepDefaults() {
		var options = RenderOptions.fromProperties(new Properties());
		Assert.assertTrue(options.pruneSpecPlaceholders());
		Assert.assertEquals(RenderOptions.StackDisplay.AUTO, options.stackDisplay());
	}

	@Test(expected = IllegalArgumentException.class)
	public void testBadStackDisplay() {
		var properties = new Properties();
		properties.setProperty(RenderOptions.STACK_KEY, "sometimes");
		RenderOptions.fromProperties(properties);
	}

	@Test
	public void testLoad() {
		var options = RenderOptions.load();
		Assert.assertTrue(options.pruneSpecPlaceholders());
		Assert.assertEquals(RenderOptions.StackDisplay.AUTO, options.stackDisplay());
		Assert.assertTrue(options.prettyXml());
	}

	@Test
	public void testNeverShowsStack() {
		var options = RenderOptions.builder().stackDisplay(RenderOptions.StackDisplay.NEVER).build();
		Assert.assertFalse(options.showStack(HeapGraph.Kind.PRE));
		var dot = new HeapRenderer(options).renderPrecondition(
				Proposition.of(Heaps.toNil("x"))).dot();
		Assert.assertFalse(dot.contains("state_pi_"));
	}
}
