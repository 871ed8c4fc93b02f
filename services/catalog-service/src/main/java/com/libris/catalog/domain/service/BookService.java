package com.libris.catalog.domain.service;

import com.libris.catalog.domain.Book;
import com.libris.catalog.domain.BookRepository;
import com.libris.catalog.domain.FavoriteRepository;
import com.libris.catalog.domain.User;
import com.libris.common.error.EditConflictException;
import com.libris.common.error.RecordNotFoundException;
import com.libris.common.validation.FieldValidator;
import com.libris.database.query.Filters;
import com.libris.database.query.Page;
import com.libris.database.query.PaginationPlanner;
import com.libris.database.query.QueryPlan;
import com.libris.database.query.SortSafelist;
import com.libris.observability.MetricFactory;
import com.libris.observability.SpanHelper;
import io.micrometer.core.instrument.Timer;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Year;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/** Catalog reads and writes, plus the current user's favourites. */
@Service
public class BookService {

    private static final Logger log = LoggerFactory.getLogger(BookService.class);

    /** Sort values accepted by the book listing. */
    public static final SortSafelist SORT_SAFELIST =
            SortSafelist.of(
                    Map.of("publishedYear", "published_year"),
                    "id", "title", "author", "publishedYear",
                    "-id", "-title", "-author", "-publishedYear");

    static final int MAX_TITLE_BYTES = 100;
    static final int MAX_AUTHOR_BYTES = 100;

    private final BookRepository books;
    private final FavoriteRepository favorites;
    private final PaginationPlanner planner;
    private final SpanHelper spans;
    private final Timer searchTimer;
    private final Clock clock;

    public BookService(
            BookRepository books,
            FavoriteRepository favorites,
            PaginationPlanner planner,
            MetricFactory metrics,
            SpanHelper spans,
            Clock clock) {
        this.books = books;
        this.favorites = favorites;
        this.planner = planner;
        this.spans = spans;
        this.clock = clock;
        this.searchTimer = metrics.timer("libris.books.search", "Book listing latency");
    }

    /**
     * Validates the listing parameters and returns one page of matching books.
     *
     * @throws com.libris.common.error.ValidationException for a bad page, page size or sort
     */
    public Page<Book> search(String title, String author, int page, int pageSize, String sort) {
        QueryPlan plan = new Filters(page, pageSize, sort, SORT_SAFELIST).plan(planner);
        return spans.inSpan(
                "books.search",
                Map.of("books.sort", sort, "books.page", String.valueOf(page)),
                () -> searchTimer.record(() -> books.search(title, author, plan)));
    }

    /** @throws RecordNotFoundException for unknown or non-positive ids */
    public Book get(long id) {
        if (id < 1) {
            throw new RecordNotFoundException("book " + id + " not found");
        }
        return books.findById(id)
                .orElseThrow(() -> new RecordNotFoundException("book " + id + " not found"));
    }

    public Book create(String title, String author, Integer publishedYear) {
        String t = title == null ? "" : title;
        String a = author == null ? "" : author;
        int year = publishedYear == null ? 0 : publishedYear;
        validate(t, a, year);

        Book created = books.insert(t, a, year);
        log.info("Created book {}", created.id());
        return created;
    }

    /**
     * Applies the non-null fields of {@code changes} to the stored book.
     *
     * @param expectedVersion when non-null, the version the client last saw
     * @throws EditConflictException if the book changed since it was read, or since the client read
     *     it
     */
    public Book update(long id, BookChanges changes, Integer expectedVersion) {
        Book current = get(id);
        if (expectedVersion != null && expectedVersion != current.version()) {
            throw new EditConflictException(
                    "book " + id + " is at version " + current.version() + ", not " + expectedVersion);
        }

        Book changed =
                current.withDetails(
                        changes.title() != null ? changes.title() : current.title(),
                        changes.author() != null ? changes.author() : current.author(),
                        changes.publishedYear() != null ? changes.publishedYear() : current.publishedYear());
        validate(changed.title(), changed.author(), changed.publishedYear());

        Book updated = books.update(changed);
        log.info("Updated book {} to version {}", id, updated.version());
        return updated;
    }

    /** @return the book as it was before deletion */
    public Book delete(long id) {
        Book existing = get(id);
        if (!books.delete(id)) {
            throw new RecordNotFoundException("book " + id + " not found");
        }
        log.info("Deleted book {}", id);
        return existing;
    }

    public Book addFavorite(User user, long bookId) {
        Book book = get(bookId);
        favorites.add(user.id(), book.id());
        log.debug("User {} favourited book {}", user.id(), book.id());
        return book;
    }

    public List<Book> favorites(User user) {
        return favorites.findBooks(user.id());
    }

    private void validate(String title, String author, int publishedYear) {
        int currentYear = Year.now(clock).getValue();
        new FieldValidator()
                .check(!title.isEmpty(), "title", "must be provided")
                .check(bytes(title) <= MAX_TITLE_BYTES, "title", "must not be more than 100 bytes long")
                .check(bytes(author) <= MAX_AUTHOR_BYTES, "author", "must not be more than 100 bytes long")
                .check(publishedYear >= 0, "publishedYear", "must not be negative")
                .check(publishedYear <= currentYear, "publishedYear", "must not be in the future")
                .throwIfInvalid();
    }

    private static int bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8).length;
    }

    /**
     * Partial update; null fields are left unchanged.
     */
    public record BookChanges(String title, String author, Integer publishedYear) {}
}
