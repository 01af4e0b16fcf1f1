package cassia.analysis;

import java.math.BigInteger;

/**
 * Class containing the integer number theory used by exact arithmetic:
 * greatest common divisors, least common multiples, exact integer roots and
 * binomial coefficients.
 */
public class GCD
{
	private GCD()
	{
	}

	/**
	 * Computes the GCD of the two given numbers. The result is never negative
	 * and the GCD of zero and zero is zero.
	 */
	public static BigInteger compute(BigInteger a, BigInteger b)
	{
		a = a.abs();
		b = b.abs();

		for (;;)
		{
			if (a.signum() == 0)
				return b;

			if (b.signum() == 0)
				return a;

			if (a.compareTo(b) > 0)
				a = a.mod(b);
			else
				b = b.mod(a);
		}
	}

	/**
	 * Computes the least common multiple of the two given numbers.
	 *
	 * @return the non-negative LCM, or zero if either number is zero.
	 */
	public static BigInteger lcm(BigInteger a, BigInteger b)
	{
		if (a.signum() == 0 || b.signum() == 0)
			return BigInteger.ZERO;
		return a.divide(compute(a, b)).multiply(b).abs();
	}

	/**
	 * Returns the exact n-th root of the given number.
	 *
	 * @param a the radicand.
	 * @param n the positive degree of the root.
	 * @return the root, or null if {@code a} is not a perfect n-th power in
	 *         the integers (negative radicands only have odd roots).
	 */
	public static BigInteger root(BigInteger a, int n)
	{
		if (n <= 0)
			throw new IllegalArgumentException("root of degree " + n);
		if (a.signum() < 0)
		{
			if (n % 2 == 0)
				return null;
			BigInteger r = root(a.negate(), n);
			return (r == null) ? null : r.negate();
		}
		if (n == 1 || a.compareTo(BigInteger.ONE) <= 0)
			return a;

		/* Binary search between 1 and 2^(bits/n + 1). */
		BigInteger low = BigInteger.ONE;
		BigInteger high = BigInteger.ONE.shiftLeft(a.bitLength() / n + 1);
		while (low.compareTo(high) <= 0)
		{
			BigInteger mid = low.add(high).shiftRight(1);
			int c = mid.pow(n).compareTo(a);
			if (c == 0)
				return mid;
			if (c < 0)
				low = mid.add(BigInteger.ONE);
			else
				high = mid.subtract(BigInteger.ONE);
		}
		return null;
	}

	/**
	 * Computes the binomial coefficient C(n, k).
	 */
	public static BigInteger binomial(int n, int k)
	{
		if (k < 0 || k > n)
			return BigInteger.ZERO;
		k = Math.min(k, n - k);
		BigInteger c = BigInteger.ONE;
		for (int i = 0; i < k; i++)
			c = c.multiply(BigInteger.valueOf(n - i)).divide(BigInteger.valueOf(i + 1));
		return c;
	}

	/**
	 * Computes the factorial of a non-negative number.
	 */
	public static BigInteger factorial(BigInteger n)
	{
		BigInteger ret = BigInteger.ONE;
		for (BigInteger i = BigInteger.valueOf(2); i.compareTo(n) <= 0; i = i.add(BigInteger.ONE))
			ret = ret.multiply(i);
		return ret;
	}
}
