package com.libris.catalog.infrastructure.persistence;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.libris.catalog.PostgresTestSupport;
import com.libris.catalog.domain.Book;
import com.libris.catalog.domain.service.BookService;
import com.libris.common.error.EditConflictException;
import com.libris.database.query.Filters;
import com.libris.database.query.Page;
import com.libris.database.query.PaginationPlanner;
import com.libris.database.query.QueryPlan;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

@DisplayName("JdbcBookRepository")
class JdbcBookRepositoryTest extends PostgresTestSupport {

    @Autowired private JdbcBookRepository books;

    private final PaginationPlanner planner = new PaginationPlanner();

    private QueryPlan plan(int page, int pageSize, String sort) {
        return new Filters(page, pageSize, sort, BookService.SORT_SAFELIST).plan(planner);
    }

    @Test
    @DisplayName("insert then findById returns the stored book at version 1")
    void insertAndFind() {
        Book created = books.insert("Dune", "Frank Herbert", 1965);

        assertThat(created.id()).isPositive();
        assertThat(created.version()).isEqualTo(1);
        assertThat(books.findById(created.id())).contains(created);
        assertThat(books.findById(created.id() + 100)).isEmpty();
    }

    @Test
    @DisplayName("delete reports whether a row was removed")
    void deleteReportsRemoval() {
        Book created = books.insert("Emma", "Jane Austen", 1815);

        assertThat(books.delete(created.id())).isTrue();
        assertThat(books.delete(created.id())).isFalse();
    }

    @Nested
    @DisplayName("search")
    class Search {

        @Test
        @DisplayName("full-text matches title words and reports the total in the same statement")
        void fullText() {
            books.insert("Dune", "Frank Herbert", 1965);
            books.insert("Dune Messiah", "Frank Herbert", 1969);
            books.insert("Emma", "Jane Austen", 1815);

            Page<Book> page = books.search("dune", "", plan(1, 1, "-publishedYear"));

            assertThat(page.records()).extracting(Book::title).containsExactly("Dune Messiah");
            assertThat(page.metadata().totalRecords()).isEqualTo(2);
            assertThat(page.metadata().lastPage()).isEqualTo(2);
        }

        @Test
        @DisplayName("empty terms match every book")
        void emptyTermsMatchAll() {
            books.insert("Dune", "Frank Herbert", 1965);
            books.insert("Emma", "Jane Austen", 1815);

            assertThat(books.search("", "", plan(1, 20, "id")).metadata().totalRecords()).isEqualTo(2);
        }

        @Test
        @DisplayName("hostile search text is bound as data")
        void hostileText() {
            books.insert("Dune", "Frank Herbert", 1965);

            Page<Book> page = books.search("'; DROP TABLE books; --", "", plan(1, 20, "id"));

            assertThat(page.records()).isEmpty();
            assertThat(books.search("", "", plan(1, 20, "id")).records()).hasSize(1);
        }

        @Test
        @DisplayName("a page past the end is empty with zero metadata")
        void pastTheEnd() {
            books.insert("Dune", "Frank Herbert", 1965);

            Page<Book> page = books.search("", "", plan(5, 20, "id"));

            assertThat(page.records()).isEmpty();
            assertThat(page.metadata().totalRecords()).isZero();
            assertThat(page.metadata().lastPage()).isZero();
        }

        @Test
        @DisplayName("duplicate sort keys page deterministically by id")
        void duplicateSortKeys() {
            List<Long> inserted = new ArrayList<>();
            for (int i = 0; i < 5; i++) {
                inserted.add(books.insert("Volume " + i, "Same Author", 2000).id());
            }

            List<Long> seen = new ArrayList<>();
            for (int page = 1; page <= 3; page++) {
                books.search("", "", plan(page, 2, "author")).records().forEach(b -> seen.add(b.id()));
            }

            assertThat(seen).containsExactlyElementsOf(inserted);
        }
    }

    @Nested
    @DisplayName("update")
    class Update {

        @Test
        @DisplayName("a versioned write increments the version")
        void incrementsVersion() {
            Book created = books.insert("Dune", "Frank Herbert", 1965);

            Book updated = books.update(created.withDetails("Dune", "F. Herbert", 1965));

            assertThat(updated.version()).isEqualTo(2);
            assertThat(updated.author()).isEqualTo("F. Herbert");
        }

        @Test
        @DisplayName("a stale version is a conflict")
        void staleVersion() {
            Book created = books.insert("Dune", "Frank Herbert", 1965);
            books.update(created.withDetails("Dune", "F. Herbert", 1965));

            assertThatThrownBy(() -> books.update(created.withDetails("Dune II", "Frank Herbert", 1965)))
                    .isInstanceOf(EditConflictException.class);
        }

        @Test
        @DisplayName("concurrent writers from the same version: exactly one wins")
        void concurrentRace() throws Exception {
            Book created = books.insert("Dune", "Frank Herbert", 1965);
            CountDownLatch start = new CountDownLatch(1);
            ExecutorService pool = Executors.newFixedThreadPool(2);
            try {
                List<Future<Book>> results = new ArrayList<>();
                for (String author : List.of("Writer A", "Writer B")) {
                    Callable<Book> write =
                            () -> {
                                start.await();
                                return books.update(created.withDetails("Dune", author, 1965));
                            };
                    results.add(pool.submit(write));
                }
                start.countDown();

                int wins = 0;
                int conflicts = 0;
                for (Future<Book> result : results) {
                    try {
                        result.get();
                        wins++;
                    } catch (ExecutionException e) {
                        assertThat(e.getCause()).isInstanceOf(EditConflictException.class);
                        conflicts++;
                    }
                }
                assertThat(wins).isEqualTo(1);
                assertThat(conflicts).isEqualTo(1);
                assertThat(books.findById(created.id())).get().extracting(Book::version).isEqualTo(2);
            } finally {
                pool.shutdownNow();
            }
        }
    }
}
