package org.metricshub.jash.intermediate;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * Jash
 * ჻჻჻჻჻჻
 * Copyright (C) 2006 - 2025 MetricsHub
 * ჻჻჻჻჻჻
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Lesser Public License for more details.
 *
 * You should have received a copy of the GNU General Lesser Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/lgpl-3.0.html>.
 * ╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱
 */

import java.io.PrintStream;

/**
 * Dumps a shell IR tree, one node per line, children indented under their
 * parent.
 */
public class ShellIRPrinter implements ShellIRVisitor<Void, RuntimeException> {

	private final PrintStream ps;
	private int level;

	/**
	 * @param ps destination stream for the listing
	 */
	public ShellIRPrinter(PrintStream ps) {
		this.ps = ps;
	}

	/**
	 * Dumps the specified tree.
	 *
	 * @param ir the tree to dump
	 */
	public void dump(ShellIR ir) {
		level = 0;
		ir.accept(this);
	}

	private void line(Object text) {
		StringBuilder spaces = new StringBuilder();
		for (int i = 0; i < level; i++) {
			spaces.append("  ");
		}
		ps.println(spaces.toString() + text);
	}

	private void child(String label, ShellIR node) {
		level++;
		if (label != null) {
			line(label);
			level++;
		}
		node.accept(this);
		if (label != null) {
			level--;
		}
		level--;
	}

	@Override
	public Void visitLet(ShellIR.Let node) {
		line(node);
		return null;
	}

	@Override
	public Void visitExec(ShellIR.Exec node) {
		line(node);
		return null;
	}

	@Override
	public Void visitIf(ShellIR.If node) {
		line(node);
		child("then", node.getThenBranch());
		if (node.getElseBranch() != null) {
			child("else", node.getElseBranch());
		}
		return null;
	}

	@Override
	public Void visitSequence(ShellIR.Sequence node) {
		line(node);
		for (ShellIR child : node.getNodes()) {
			child(null, child);
		}
		return null;
	}

	@Override
	public Void visitFunction(ShellIR.Function node) {
		line(node);
		child(null, node.getBody());
		return null;
	}

	@Override
	public Void visitEcho(ShellIR.Echo node) {
		line(node);
		return null;
	}

	@Override
	public Void visitFor(ShellIR.For node) {
		line(node);
		child(null, node.getBody());
		return null;
	}

	@Override
	public Void visitForIn(ShellIR.ForIn node) {
		line(node);
		child(null, node.getBody());
		return null;
	}

	@Override
	public Void visitWhile(ShellIR.While node) {
		line(node);
		child(null, node.getBody());
		return null;
	}

	@Override
	public Void visitBreak(ShellIR.Break node) {
		line(node);
		return null;
	}

	@Override
	public Void visitContinue(ShellIR.Continue node) {
		line(node);
		return null;
	}

	@Override
	public Void visitCase(ShellIR.Case node) {
		line(node);
		for (CaseArm arm : node.getArms()) {
			child(arm.getPattern() + ")", arm.getBody());
		}
		return null;
	}

	@Override
	public Void visitReturn(ShellIR.Return node) {
		line(node);
		return null;
	}

	@Override
	public Void visitExit(ShellIR.Exit node) {
		line(node);
		return null;
	}

	@Override
	public Void visitNoop(ShellIR.Noop node) {
		line(node);
		return null;
	}
}
