package py2coffee.print;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class NumberLiteralsTest {
	@Test
	void integersComeOutInDecimal() {
		assertEquals("255", NumberLiterals.canonical("0xff"));
		assertEquals("8", NumberLiterals.canonical("0o10"));
		assertEquals("5", NumberLiterals.canonical("0b101"));
		assertEquals("1000000", NumberLiterals.canonical("1_000_000"));
		assertEquals("123456789012345678901234567890", NumberLiterals.canonical("123456789012345678901234567890"));
	}

	@Test
	void floatsFollowReprLayout() {
		assertEquals("1.0", NumberLiterals.canonical("1."));
		assertEquals("0.5", NumberLiterals.canonical(".5"));
		assertEquals("1e+16", NumberLiterals.canonical("1e16"));
		assertEquals("1e-05", NumberLiterals.canonical("0.00001"));
		assertEquals("0.0001", NumberLiterals.canonical("1e-4"));
		assertEquals("1.5e+20", NumberLiterals.canonical("15e19"));
		assertEquals("Infinity", NumberLiterals.canonical("1e999"));
	}

	@Test
	void imaginaryKeepsItsSuffix() {
		assertEquals("2j", NumberLiterals.canonical("2j"));
		assertEquals("1.5j", NumberLiterals.canonical("1.5J"));
	}

	@Test
	void floatsUseFewestRoundTripDigits() {
		assertEquals("2.82879384806159e+17", NumberLiterals.canonical("2.82879384806159e17"));
		assertEquals("5e-324", NumberLiterals.canonical("5e-324"));
		assertEquals("0.1", NumberLiterals.canonical("0.1"));
		assertEquals("1e+23", NumberLiterals.canonical("1e23"));
	}
}
