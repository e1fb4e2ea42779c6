package org.yuho.verify;

public enum Verdict
{
	VALID,
	INVALID,
	/** The solver answered without concluding, e.g. on an incomplete theory combination. */
	UNKNOWN,
	TIMED_OUT
}
