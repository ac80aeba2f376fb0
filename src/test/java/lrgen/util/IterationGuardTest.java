package lrgen.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class IterationGuardTest {

	@Test
	public void testLimit(){
		IterationGuard guard = new IterationGuard("loop", 2);
		guard.next();
		guard.next();
		assertEquals(2, guard.getIterations());
		IllegalStateException ex = assertThrows(IllegalStateException.class, guard::next);
		assertTrue(ex.getMessage().contains("loop"));
	}
}
