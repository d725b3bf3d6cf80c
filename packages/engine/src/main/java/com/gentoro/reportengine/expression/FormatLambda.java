package com.gentoro.reportengine.expression;

/** Parsed {@code lambda <parameter>: <body>} format function. */
public record FormatLambda(String parameter, Expression body) {}
