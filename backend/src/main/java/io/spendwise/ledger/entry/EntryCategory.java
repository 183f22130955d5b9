package io.spendwise.ledger.entry;

/** Closed set of ledger categories, each with the label shown to users. */
public enum EntryCategory {
  FOOD_AND_DINING("Food & Dining"),
  TRANSPORTATION("Transportation"),
  SHOPPING("Shopping"),
  ENTERTAINMENT("Entertainment"),
  HEALTHCARE("Healthcare"),
  UTILITIES("Utilities"),
  EDUCATION("Education"),
  TRAVEL("Travel"),
  SALARY("Salary"),
  BUSINESS("Business"),
  INVESTMENT("Investment"),
  RENT_MORTGAGE("Rent/Mortgage"),
  SUBSCRIPTIONS("Subscriptions"),
  OTHERS("Others");

  private final String label;

  EntryCategory(String label) {
    this.label = label;
  }

  public String getLabel() {
    return label;
  }
}
