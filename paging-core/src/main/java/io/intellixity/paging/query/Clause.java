package io.intellixity.paging.query;

public enum Clause { AND, OR }
