package org.javai.springai.chain.instrument;

public enum InvocationEventType {
	REQUESTED,
	STARTED,
	SUCCEEDED,
	FAILED
}
