package io.spendwise.ledger.entry;

public enum EntryType {
  INCOME,
  EXPENSE
}
