package cassia.analysis;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

public class GCDTest
{
	private static BigInteger big(long value)
	{
		return BigInteger.valueOf(value);
	}

	@Test
	public void computesGcdAndLcm()
	{
		assertEquals(big(6), GCD.compute(big(12), big(-18)));
		assertEquals(big(7), GCD.compute(big(0), big(7)));
		assertEquals(big(0), GCD.compute(big(0), big(0)));
		assertEquals(big(12), GCD.lcm(big(4), big(6)));
		assertEquals(big(0), GCD.lcm(big(0), big(6)));
	}

	@Test
	public void computesExactRoots()
	{
		assertEquals(big(3), GCD.root(big(27), 3));
		assertNull(GCD.root(big(28), 3));
		assertEquals(big(-2), GCD.root(big(-8), 3));
		assertNull(GCD.root(big(-4), 2));
		assertEquals(big(1), GCD.root(big(1), 5));
		assertEquals(BigInteger.TEN.pow(20), GCD.root(BigInteger.TEN.pow(40), 2));
	}

	@Test
	public void rejectsRootOfNonPositiveDegree()
	{
		try {
			GCD.root(big(4), 0);
			fail("a root of degree 0 was computed");
		} catch (IllegalArgumentException ex) {
			assertTrue(ex.getMessage().contains("degree"));
		}
	}

	@Test
	public void computesBinomialsAndFactorials()
	{
		assertEquals(big(10), GCD.binomial(5, 2));
		assertEquals(big(1), GCD.binomial(7, 0));
		assertEquals(big(0), GCD.binomial(3, 5));
		assertEquals(big(120), GCD.factorial(big(5)));
		assertEquals(big(1), GCD.factorial(big(0)));
	}
}
