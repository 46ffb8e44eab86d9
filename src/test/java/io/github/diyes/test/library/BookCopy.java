package io.github.diyes.test.library;

public final class BookCopy {
  private final String barcode;
  private String borrowerId;

  BookCopy(String barcode) {
    this.barcode = barcode;
  }

  void checkOut(String borrowerId) {
    this.borrowerId = borrowerId;
  }

  void checkIn() {
    this.borrowerId = null;
  }

  public String barcode() {
    return barcode;
  }

  public String borrowerId() {
    return borrowerId;
  }

  public boolean isBorrowed() {
    return borrowerId != null;
  }
}
