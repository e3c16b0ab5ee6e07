package io.github.cyfko.filterable.jpa;

import io.github.cyfko.filterable.core.config.AllowList;
import io.github.cyfko.filterable.core.config.FilterConfig;
import io.github.cyfko.filterable.core.exception.FilterValidationException;
import io.github.cyfko.filterable.core.model.FilterSpec;
import io.github.cyfko.filterable.jpa.entities.Author;
import io.github.cyfko.filterable.jpa.entities.Book;
import io.github.cyfko.filterable.jpa.entities.BookStatus;
import io.github.cyfko.filterable.jpa.entities.Profile;
import jakarta.persistence.EntityManager;
import jakarta.persistence.EntityManagerFactory;
import jakarta.persistence.Persistence;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaQuery;
import jakarta.persistence.criteria.Root;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end filtering against an in-memory H2 database.
 * Fixtures are inserted once; tests only read.
 */
@DisplayName("JpaFilterable Test")
class JpaFilterableTest {

    private static final List<String> ALL_TITLES = List.of(
            "Ancillary Justice", "Ancillary Sword", "Café Stories", "Le Petit Livre", "Old Notes", "Orphan");

    private static EntityManagerFactory emf;

    private final JpaFilterable<Book> books = new JpaFilterable<>(Book.class, AllowList.builder()
            .fields("title", "pages", "price", "status", "publishedOn", "deletedAt")
            .relations("author")
            .build());

    private final JpaFilterable<Author> authors = new JpaFilterable<>(Author.class, AllowList.builder()
            .fields("name", "country")
            .relations("books", "profile")
            .build());

    @BeforeAll
    static void setup() {
        emf = Persistence.createEntityManagerFactory("testPU");

        EntityManager em = emf.createEntityManager();
        em.getTransaction().begin();

        Profile leckieProfile = new Profile("US", true);
        Profile dupontProfile = new Profile("FR", false);
        em.persist(leckieProfile);
        em.persist(dupontProfile);

        Author leckie = new Author("Ann Leckie", "US", leckieProfile);
        Author dupont = new Author("Jean Dupont", "FR", dupontProfile);
        Author unal = new Author("Zoë Ünal", "TR", null);
        em.persist(leckie);
        em.persist(dupont);
        em.persist(unal);

        em.persist(new Book("Ancillary Justice", 416, 15.5, BookStatus.PUBLISHED, LocalDate.of(2013, 10, 1), null, leckie));
        em.persist(new Book("Ancillary Sword", 356, 14.0, BookStatus.PUBLISHED, LocalDate.of(2014, 10, 7), null, leckie));
        em.persist(new Book("Le Petit Livre", 120, 9.99, BookStatus.DRAFT, null, null, dupont));
        em.persist(new Book("Old Notes", 80, 5.0, BookStatus.ARCHIVED, LocalDate.of(2001, 1, 1), LocalDate.of(2020, 1, 1), dupont));
        em.persist(new Book("Café Stories", 200, 12.0, BookStatus.PUBLISHED, LocalDate.of(2019, 5, 5), null, unal));
        em.persist(new Book("Orphan", 50, 3.0, BookStatus.DRAFT, null, null, null));

        em.getTransaction().commit();
        em.close();
    }

    @AfterAll
    static void teardown() {
        if (emf != null) emf.close();
    }

    private static <T> T inEntityManager(Function<EntityManager, T> work) {
        EntityManager em = emf.createEntityManager();
        try {
            return work.apply(em);
        } finally {
            em.close();
        }
    }

    private List<String> titles(FilterSpec spec) {
        return inEntityManager(em -> books.find(em, spec).stream()
                .map(Book::getTitle)
                .sorted()
                .toList());
    }

    private List<String> titlesWhere(String key, Object value) {
        Map<String, Object> all = new LinkedHashMap<>();
        all.put(key, value);
        return titles(FilterSpec.of(all, null));
    }

    // ============================================================================
    // Operators
    // ============================================================================

    @Nested
    @DisplayName("Operators")
    class Operators {

        @Test
        @DisplayName("Scalar value should match as a substring")
        void scalarShouldMatchSubstring() {
            assertEquals(List.of("Ancillary Justice", "Ancillary Sword"), titlesWhere("title", "Ancillary"));
        }

        @Test
        @DisplayName("EQ and NE should compare converted values")
        void equalityShouldCompareConvertedValues() {
            assertEquals(List.of("Ancillary Sword"), titlesWhere("publishedOn", Map.of("equal", "2014-10-07")));
            assertEquals(List.of("Ancillary Justice", "Ancillary Sword", "Café Stories", "Le Petit Livre", "Orphan"),
                    titlesWhere("status", Map.of("<>", "archived")));
        }

        @Test
        @DisplayName("Ordered comparisons should convert numeric text")
        void orderedComparisonsShouldConvertText() {
            assertEquals(List.of("Ancillary Justice", "Ancillary Sword"), titlesWhere("pages", Map.of("gte", "356")));
            assertEquals(List.of("Old Notes", "Orphan"), titlesWhere("pages", Map.of("<", "100")));
        }

        @Test
        @DisplayName("Several operators of one key should all apply")
        void operatorsOfOneKeyShouldConjoin() {
            Map<String, Object> operators = new LinkedHashMap<>();
            operators.put("gt", "100");
            operators.put("lte", "356");

            assertEquals(List.of("Ancillary Sword", "Café Stories", "Le Petit Livre"), titlesWhere("pages", operators));
        }

        @Test
        @DisplayName("Pattern operators should place wildcards")
        void patternOperatorsShouldPlaceWildcards() {
            assertEquals(List.of("Old Notes"), titlesWhere("title", Map.of("startswith", "Old")));
            assertEquals(List.of("Ancillary Sword"), titlesWhere("title", Map.of("endswith", "Sword")));
            assertEquals(List.of("Café Stories", "Le Petit Livre", "Old Notes", "Orphan"),
                    titlesWhere("title", Map.of("notlike", "Ancillary")));
        }

        @Test
        @DisplayName("Pattern on a numeric attribute should match its string form")
        void patternShouldMatchNumericStringForm() {
            assertEquals(List.of("Ancillary Justice"), titlesWhere("pages", Map.of("like", "41")));
        }

        @Test
        @DisplayName("IN and NOT IN should convert enum names ignoring case")
        void membershipShouldConvertEnums() {
            assertEquals(List.of("Ancillary Justice", "Ancillary Sword", "Café Stories", "Old Notes"),
                    titlesWhere("status", Map.of("in", List.of("published", "ARCHIVED"))));
            assertEquals(List.of("Ancillary Justice", "Ancillary Sword", "Café Stories", "Old Notes"),
                    titlesWhere("status", Map.of("notin", "draft")));
        }

        @Test
        @DisplayName("IN over nothing should match nothing, NOT IN over nothing everything")
        void emptyMembershipShouldBeConstant() {
            assertEquals(List.of(), titlesWhere("status", Map.of("in", List.of())));
            assertEquals(ALL_TITLES, titlesWhere("status", Map.of("notin", List.of())));
        }

        @Test
        @DisplayName("BETWEEN should be inclusive and NOT BETWEEN its complement")
        void rangeShouldBeInclusive() {
            assertEquals(List.of("Ancillary Sword", "Café Stories"), titlesWhere("price", Map.of("between", List.of("10", "14"))));
            assertEquals(List.of("Ancillary Justice", "Le Petit Livre", "Old Notes", "Orphan"),
                    titlesWhere("price", Map.of("notbetween", List.of("10", "14"))));
        }

        @Test
        @DisplayName("Null checks should ignore their operand")
        void nullChecksShouldIgnoreOperand() {
            assertEquals(List.of("Old Notes"), titlesWhere("deletedAt", Map.of("notnull", "anything")));
            assertEquals(List.of("Le Petit Livre", "Orphan"), titlesWhere("publishedOn", Map.of("null", "1")));
        }

        @Test
        @DisplayName("Equality with a null operand should test for null")
        void equalityWithNullShouldTestNull() {
            Map<String, Object> operators = new LinkedHashMap<>();
            operators.put("=", null);

            assertEquals(List.of("Le Petit Livre", "Orphan"), titlesWhere("publishedOn", operators));
        }

        @Test
        @DisplayName("Unknown operators should leave results unfiltered")
        void unknownOperatorShouldNotFilter() {
            assertEquals(ALL_TITLES, titlesWhere("title", Map.of("regex", "^A")));
        }
    }

    // ============================================================================
    // Relations
    // ============================================================================

    @Nested
    @DisplayName("Relations")
    class Relations {

        @Test
        @DisplayName("Relation key should filter on the related entity")
        void relationKeyShouldFilterRelated() {
            assertEquals(List.of("Ancillary Justice", "Ancillary Sword"), titlesWhere("author.country", "US"));
        }

        @Test
        @DisplayName("Nested relation path should join every segment")
        void nestedRelationShouldJoinEverySegment() {
            assertEquals(List.of("Le Petit Livre", "Old Notes"), titlesWhere("author.profile.country", Map.of("equal", "FR")));
            assertEquals(List.of("Ancillary Justice", "Ancillary Sword"), titlesWhere("author.profile.verified", Map.of("=", "yes")));
        }

        @Test
        @DisplayName("Relation without usable clause should still require the relation")
        void relationWithoutClauseShouldRequireRelation() {
            assertEquals(List.of("Ancillary Justice", "Ancillary Sword", "Café Stories", "Le Petit Livre", "Old Notes"),
                    titlesWhere("author.name", Map.of("regex", "x")));
        }

        @Test
        @DisplayName("To-many relation should not duplicate root rows")
        void toManyRelationShouldNotDuplicate() {
            FilterSpec spec = FilterSpec.builder().all("books.title", "Ancillary").build();

            List<String> names = inEntityManager(em -> authors.find(em, spec).stream().map(Author::getName).toList());
            long count = inEntityManager(em -> authors.count(em, spec));

            assertEquals(List.of("Ann Leckie"), names);
            assertEquals(1L, count);
        }

        @Test
        @DisplayName("Relation not in the allow-list should be ignored")
        void disallowedRelationShouldBeIgnored() {
            assertEquals(ALL_TITLES, titlesWhere("publisher.name", "x"));
        }
    }

    // ============================================================================
    // Requests
    // ============================================================================

    @Nested
    @DisplayName("Requests")
    class Requests {

        @Test
        @DisplayName("OR group should match any of its keys")
        void orGroupShouldMatchAny() {
            FilterSpec spec = FilterSpec.builder()
                    .any("title", "Sword")
                    .any("pages", Map.of("lt", "100"))
                    .build();

            assertEquals(List.of("Ancillary Sword", "Old Notes", "Orphan"), titles(spec));
        }

        @Test
        @DisplayName("AND group and OR group should both hold")
        void andAndOrGroupsShouldBothHold() {
            FilterSpec spec = FilterSpec.builder()
                    .all("status", Map.of("in", List.of("PUBLISHED")))
                    .any("author.country", Map.of("=", "TR"))
                    .any("pages", Map.of(">", "400"))
                    .build();

            assertEquals(List.of("Ancillary Justice", "Café Stories"), titles(spec));
        }

        @Test
        @DisplayName("Decoded request should use the configured keys and percent-decode operands")
        void decodedRequestShouldBeHonoured() {
            JpaFilterable<Book> custom = new JpaFilterable<>(Book.class,
                    AllowList.builder().fields("title").build(),
                    FilterConfig.builder().requestKey("q").anyRequestKey("q_any").build());
            Map<String, Object> request = Map.of(
                    "q", Map.of("title", "Caf%C3%A9"),
                    "filter", Map.of("title", "Ancillary"));

            List<String> titles = inEntityManager(em -> custom.find(em, request).stream().map(Book::getTitle).toList());

            assertEquals(List.of("Café Stories"), titles);
        }

        @Test
        @DisplayName("Empty and disallowed filters should leave results unfiltered")
        void emptyFiltersShouldNotFilter() {
            FilterSpec spec = FilterSpec.builder().all("title", "").all("secret", "x").build();

            assertEquals(ALL_TITLES, titles(spec));
            assertEquals(6L, (long) inEntityManager(em -> books.count(em, spec)));
            assertEquals(6L, (long) inEntityManager(em -> books.count(em, Map.of())));
        }

        @Test
        @DisplayName("Count should agree with find")
        void countShouldAgreeWithFind() {
            Map<String, Object> request = Map.of("filter", Map.of("price", Map.of("gte", "10")));

            long count = inEntityManager(em -> books.count(em, request));
            int found = inEntityManager(em -> books.find(em, request).size());

            assertEquals(3L, count);
            assertEquals(3, found);
        }

        @Test
        @DisplayName("Unconvertible operand should raise FilterValidationException")
        void unconvertibleOperandShouldFail() {
            FilterSpec spec = FilterSpec.builder().all("pages", Map.of("gt", "many")).build();

            FilterValidationException ex = assertThrows(FilterValidationException.class, () -> titles(spec));
            assertTrue(ex.getMessage().contains("pages"));
            assertFalse(ex.getMessage().contains("many"));
        }
    }

    @Test
    @DisplayName("Resolver should compose with other criteria")
    void resolverShouldCompose() {
        PredicateResolver<Book> published = books.toResolver(FilterSpec.builder()
                .all("status", Map.of("=", "PUBLISHED")).build());
        PredicateResolver<Book> cheap = (root, query, cb) -> cb.lessThan(root.get("price"), 14.5);

        List<String> titles = inEntityManager(em -> {
            CriteriaBuilder cb = em.getCriteriaBuilder();
            CriteriaQuery<Book> query = cb.createQuery(Book.class);
            Root<Book> root = query.from(Book.class);
            query.where(published.and(cheap).resolve(root, query, cb));
            return em.createQuery(query).getResultList().stream().map(Book::getTitle).sorted().toList();
        });

        assertEquals(Arrays.asList("Ancillary Sword", "Café Stories"), titles);
    }
}
