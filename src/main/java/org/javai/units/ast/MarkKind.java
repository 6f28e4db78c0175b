package org.javai.units.ast;

/**
 * The three flavours of braced mark.
 */
public enum MarkKind {

	CHEMICAL("chem", AtomKind.CHEMICAL),
	CURRENCY("currency", AtomKind.CURRENCY),
	USER(null, AtomKind.USER);

	private final String tag;
	private final AtomKind atomKind;

	MarkKind(String tag, AtomKind atomKind) {
		this.tag = tag;
		this.atomKind = atomKind;
	}

	/**
	 * The tag written before the colon inside the braces, or null for user marks.
	 */
	public String tag() {
		return tag;
	}

	public AtomKind atomKind() {
		return atomKind;
	}

	/**
	 * Brace-delimited text for a payload of this kind.
	 */
	public String render(String payload) {
		return tag == null ? "{" + payload + "}" : "{" + tag + ": " + payload + "}";
	}
}
