package io.github.diyes.test.library;

import io.github.diyes.ddd.es.AggregateRoot;
import io.github.diyes.ddd.es.DomainRuleViolationException;
import io.github.diyes.ddd.es.EventHandlers;
import io.github.diyes.test.library.BookEvent.BookAuthorUpdated;
import io.github.diyes.test.library.BookEvent.BookCreated;
import io.github.diyes.test.library.BookEvent.BookTitleUpdated;
import io.github.diyes.test.library.BookEvent.BookYearPublishedUpdated;
import io.github.diyes.test.library.BookEvent.CopyAdded;
import io.github.diyes.test.library.BookEvent.CopyBorrowed;
import io.github.diyes.test.library.BookEvent.CopyRemoved;
import io.github.diyes.test.library.BookEvent.CopyReturned;
import java.time.Duration;
import java.time.Instant;
import java.time.Year;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

public class Book extends AggregateRoot<String, BookEvent, Book> {
  static final Duration LOAN_PERIOD = Duration.ofDays(14);

  private static final Pattern ISBN = Pattern.compile("^\\d{13}$");

  private static final EventHandlers<Book, BookEvent> HANDLERS =
      EventHandlers.builder(Book.class, BookEvent.class)
          .ignore(BookCreated.class)
          .on(BookTitleUpdated.class, Book::onTitleUpdated)
          .on(BookAuthorUpdated.class, Book::onAuthorUpdated)
          .on(BookYearPublishedUpdated.class, Book::onYearPublishedUpdated)
          .on(CopyAdded.class, Book::onCopyAdded)
          .on(CopyRemoved.class, Book::onCopyRemoved)
          .on(CopyBorrowed.class, Book::onCopyBorrowed)
          .on(CopyReturned.class, Book::onCopyReturned)
          .build();

  private String title;
  private String author;
  private int yearPublished;
  private final List<BookCopy> copies = new ArrayList<>();

  public Book(String isbn) {
    super(isbn);
  }

  public static Book create(String isbn, String title, String author, int yearPublished) {
    if (isbn == null || !ISBN.matcher(isbn).matches()) {
      throw new DomainRuleViolationException("ISBN must be 13 digits");
    }

    requireNotEmpty(title, "Title");
    requireNotEmpty(author, "Author");
    requireValidYear(yearPublished);

    final Book book = new Book(isbn);
    book.produceEvents(
        new BookCreated(),
        new BookTitleUpdated(title),
        new BookAuthorUpdated(author),
        new BookYearPublishedUpdated(yearPublished));
    return book;
  }

  public static Book replay(String isbn, Iterable<? extends BookEvent> history) {
    return AggregateRoot.replay(Book::new, isbn, history);
  }

  @Override
  protected EventHandlers<Book, BookEvent> eventHandlers() {
    return HANDLERS;
  }

  public BookTitleUpdated updateTitle(String title) {
    return command(
        () -> {
          requireNotEmpty(title, "Title");
          return new BookTitleUpdated(title);
        });
  }

  public BookAuthorUpdated updateAuthor(String author) {
    return command(
        () -> {
          requireNotEmpty(author, "Author");
          return new BookAuthorUpdated(author);
        });
  }

  public BookYearPublishedUpdated updateYearPublished(int yearPublished) {
    return command(
        () -> {
          requireValidYear(yearPublished);
          return new BookYearPublishedUpdated(yearPublished);
        });
  }

  public CopyAdded addCopy(String barcode) {
    return command(
        () -> {
          requireNotEmpty(barcode, "Barcode");
          if (findCopy(barcode).isPresent()) {
            throw new DomainRuleViolationException("Copy already exists");
          }

          return new CopyAdded(barcode, Instant.now());
        });
  }

  public CopyRemoved removeCopy(String barcode) {
    return command(
        () -> {
          requireCopy(barcode);
          return new CopyRemoved(barcode, Instant.now());
        });
  }

  public CopyBorrowed borrowCopy(String barcode, String borrowerId) {
    return command(
        () -> {
          requireNotEmpty(borrowerId, "Borrower");
          if (requireCopy(barcode).isBorrowed()) {
            throw new DomainRuleViolationException("Copy is already borrowed");
          }

          final Instant now = Instant.now();
          return new CopyBorrowed(barcode, now, borrowerId, now.plus(LOAN_PERIOD));
        });
  }

  public CopyReturned returnCopy(String barcode) {
    return command(
        () -> {
          if (!requireCopy(barcode).isBorrowed()) {
            throw new DomainRuleViolationException("Copy is not borrowed");
          }

          return new CopyReturned(barcode, Instant.now());
        });
  }

  public String title() {
    return title;
  }

  public String author() {
    return author;
  }

  public int yearPublished() {
    return yearPublished;
  }

  public List<BookCopy> copies() {
    return Collections.unmodifiableList(copies);
  }

  private void onTitleUpdated(BookTitleUpdated event) {
    this.title = event.title();
  }

  private void onAuthorUpdated(BookAuthorUpdated event) {
    this.author = event.author();
  }

  private void onYearPublishedUpdated(BookYearPublishedUpdated event) {
    this.yearPublished = event.yearPublished();
  }

  private void onCopyAdded(CopyAdded event) {
    copies.add(new BookCopy(event.barcode()));
  }

  private void onCopyRemoved(CopyRemoved event) {
    copies.removeIf(copy -> copy.barcode().equals(event.barcode()));
  }

  private void onCopyBorrowed(CopyBorrowed event) {
    findCopy(event.barcode()).ifPresent(copy -> copy.checkOut(event.borrowerId()));
  }

  private void onCopyReturned(CopyReturned event) {
    findCopy(event.barcode()).ifPresent(BookCopy::checkIn);
  }

  private Optional<BookCopy> findCopy(String barcode) {
    return copies.stream().filter(copy -> copy.barcode().equals(barcode)).findFirst();
  }

  private BookCopy requireCopy(String barcode) {
    return findCopy(barcode)
        .orElseThrow(() -> new DomainRuleViolationException("Copy not found"));
  }

  private static void requireNotEmpty(String value, String what) {
    if (value == null || value.isEmpty()) {
      throw new DomainRuleViolationException("%s cannot be empty".formatted(what));
    }
  }

  private static void requireValidYear(int yearPublished) {
    if (yearPublished < 0 || yearPublished > Year.now().getValue()) {
      throw new DomainRuleViolationException("Invalid year published");
    }
  }
}
