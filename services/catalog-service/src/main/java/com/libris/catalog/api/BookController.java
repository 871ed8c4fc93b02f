package com.libris.catalog.api;

import com.libris.catalog.config.PaginationProperties;
import com.libris.catalog.domain.Book;
import com.libris.catalog.domain.User;
import com.libris.catalog.domain.service.BookService;
import com.libris.catalog.domain.service.BookService.BookChanges;
import com.libris.catalog.infrastructure.web.CurrentUser;
import com.libris.common.validation.FieldValidator;
import com.libris.database.query.Page;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * Book catalog endpoints. Reads are public; writes require a bearer token.
 *
 * <p>Listing parameters: {@code title}, {@code author} (full-text, empty matches all),
 * {@code page} (default 1), {@code page_size} (default from {@code libris.pagination}),
 * {@code sort} (default {@code id}, see {@link BookService#SORT_SAFELIST}).
 */
@RestController
@RequestMapping("/api/v1")
public class BookController {

    public static final String EXPECTED_VERSION_HEADER = "X-Expected-Version";

    private final BookService books;
    private final PaginationProperties pagination;

    public BookController(BookService books, PaginationProperties pagination) {
        this.books = books;
        this.pagination = pagination;
    }

    @GetMapping("/books")
    public Map<String, Object> listBooks(
            @RequestParam(required = false) String title,
            @RequestParam(required = false) String author,
            @RequestParam(required = false) String page,
            @RequestParam(name = "page_size", required = false) String pageSize,
            @RequestParam(required = false) String sort) {
        var v = new FieldValidator();
        int pageNumber = QueryParams.readInt(page, 1, "page", v);
        int size = QueryParams.readInt(pageSize, pagination.defaultPageSize(), "page_size", v);
        v.throwIfInvalid();

        Page<Book> result =
                books.search(
                        QueryParams.readString(title, ""),
                        QueryParams.readString(author, ""),
                        pageNumber,
                        size,
                        QueryParams.readString(sort, "id"));
        return Map.of("books", result.records(), "metadata", result.metadata());
    }

    @GetMapping("/books/{id}")
    public Map<String, Object> getBook(@PathVariable long id) {
        return Map.of("book", books.get(id));
    }

    @PostMapping("/books")
    @ResponseStatus(HttpStatus.CREATED)
    public Map<String, Object> createBook(@CurrentUser User user, @RequestBody BookRequest request) {
        return Map.of("book", books.create(request.title(), request.author(), request.publishedYear()));
    }

    @PatchMapping("/books/{id}")
    public Map<String, Object> updateBook(
            @CurrentUser User user,
            @PathVariable long id,
            @RequestHeader(name = EXPECTED_VERSION_HEADER, required = false) Integer expectedVersion,
            @RequestBody BookRequest request) {
        var changes = new BookChanges(request.title(), request.author(), request.publishedYear());
        return Map.of("book", books.update(id, changes, expectedVersion));
    }

    @DeleteMapping("/books/{id}")
    public Map<String, Object> deleteBook(@CurrentUser User user, @PathVariable long id) {
        return Map.of("message", "book successfully deleted", "book", books.delete(id));
    }

    @PostMapping("/books/{id}/favorites")
    @ResponseStatus(HttpStatus.CREATED)
    public Map<String, Object> addFavorite(@CurrentUser User user, @PathVariable long id) {
        return Map.of("book", books.addFavorite(user, id));
    }

    @GetMapping("/users/me/favorites")
    public Map<String, Object> listFavorites(@CurrentUser User user) {
        return Map.of("books", books.favorites(user));
    }
}
