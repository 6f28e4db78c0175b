package org.javai.units.ast;

public enum AtomKind {
	UNIT,
	CHEMICAL,
	CURRENCY,
	USER
}
