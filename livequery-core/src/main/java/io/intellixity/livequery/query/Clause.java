package io.intellixity.livequery.query;

public enum Clause { AND, OR }
