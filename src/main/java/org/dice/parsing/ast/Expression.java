package org.dice.parsing.ast;

import java.util.List;
import java.util.Map;
import java.util.SortedSet;

/**
 * <iff>::=<implies>{<-><implies>}
 * <implies>::=<or>{-><or>}
 * <or>::=<and>{|<and>}
 * <and>::=<not>{&<not>}
 * <not>::=~<not>|<atom>
 * <atom>::=(<iff>)|<identifier>
 *
 * Nodes are immutable and allocated by an {@link ExpressionArena}; {@link #getIndex()} is the
 * node's identity within that arena.
 */
public interface Expression {

	int getIndex();

	boolean evaluate(Map<String, Boolean> assignment);

	SortedSet<String> collectVariables();

	/**
	 * @return fully parenthesised canonical form, e.g. {@code ((p & q) -> ~r)}
	 */
	String render();

	List<Expression> getChildren();
}
