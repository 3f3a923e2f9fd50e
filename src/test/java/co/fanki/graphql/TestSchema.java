package co.fanki.graphql;

import co.fanki.graphql.schema.ArgumentDefinition;
import co.fanki.graphql.schema.CacheControl;
import co.fanki.graphql.schema.EnumType;
import co.fanki.graphql.schema.FieldDefinition;
import co.fanki.graphql.schema.InputObjectType;
import co.fanki.graphql.schema.InterfaceType;
import co.fanki.graphql.schema.ObjectType;
import co.fanki.graphql.schema.Scalars;
import co.fanki.graphql.schema.Schema;
import co.fanki.graphql.schema.UnionType;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A small users and posts schema shared by the tests.
 *
 * <p>Each instance keeps its own mutation state.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class TestSchema {

    /** A user. */
    public record User(Integer id, String name, Role role, List<String> tags,
            List<Integer> friendIds) {
    }

    /** A post. */
    public record Post(Integer id, String title, Integer authorId) {
    }

    /** User roles. */
    public enum Role {
        ADMIN, MEMBER
    }

    private final Map<Integer, User> users = new LinkedHashMap<>();
    private final Map<Integer, Post> posts = new LinkedHashMap<>();
    private final List<String> mutationLog =
            Collections.synchronizedList(new ArrayList<>());
    private final AtomicInteger counter = new AtomicInteger();
    private final CountDownLatch slowStarted = new CountDownLatch(1);
    private final Schema schema;

    /** Creates the fixture. */
    public TestSchema() {
        users.put(1, new User(1, "Ann", Role.ADMIN, List.of("staff"),
                List.of(2)));
        users.put(2, new User(2, "Bob", Role.MEMBER, List.of(), List.of(1)));
        users.put(3, new User(null, "Ghost", Role.MEMBER, List.of(),
                List.of()));
        posts.put(10, new Post(10, "Hello", 1));
        schema = build();
    }

    public Schema schema() {
        return schema;
    }

    /** Returns the mutation resolvers that ran, in order. */
    public List<String> mutationLog() {
        return mutationLog;
    }

    /**
     * Waits until the {@code slow} resolver started.
     *
     * @return true if it started within a second
     * @throws InterruptedException if interrupted
     */
    public boolean awaitSlowStarted() throws InterruptedException {
        return slowStarted.await(1, TimeUnit.SECONDS);
    }

    private Schema build() {
        final InterfaceType node = InterfaceType.newInterface("Node")
                .field("id", "Int!")
                .build();

        final ObjectType user = ObjectType.newObject("User")
                .implementing("Node")
                .isTypeOf(value -> value instanceof User)
                .field("id", "Int!")
                .field("name", "String")
                .field("role", "Role")
                .field("tags", "[String!]")
                .field("friends", "[User]", (parent, args, ctx) ->
                        ((User) parent).friendIds().stream()
                                .map(users::get)
                                .toList())
                .field("bestFriend", "User!", (parent, args, ctx) -> null)
                .field(FieldDefinition.newField("email", "String")
                        .deprecate("Not exposed anymore"))
                .build();

        final ObjectType post = ObjectType.newObject("Post")
                .implementing("Node")
                .isTypeOf(value -> value instanceof Post)
                .cacheControl(CacheControl.publicFor(60))
                .field("id", "Int!")
                .field("title", "String")
                .field("author", "User", (parent, args, ctx) ->
                        users.get(((Post) parent).authorId()))
                .build();

        final InputObjectType postInput = InputObjectType.of("PostInput",
                ArgumentDefinition.of("title", "String!"),
                ArgumentDefinition.of("draft", "Boolean", "false"));

        final ObjectType query = ObjectType.newObject("Query")
                .field(FieldDefinition.newField("user", "User")
                        .argument("id", "Int!")
                        .resolver((parent, args, ctx) ->
                                users.get((Integer) args.get("id"))))
                .field("users", "[User!]!", (parent, args, ctx) ->
                        List.copyOf(users.values()).subList(0, 2))
                .field(FieldDefinition.newField("node", "Node")
                        .argument("id", "Int!")
                        .resolver((parent, args, ctx) -> {
                            final Integer id = (Integer) args.get("id");
                            return users.containsKey(id)
                                    ? users.get(id)
                                    : posts.get(id);
                        }))
                .field("search", "[SearchResult]", (parent, args, ctx) ->
                        List.of(users.get(1), posts.get(10)))
                .field(FieldDefinition.newField("posts", "[Post]")
                        .cacheControl(CacheControl.privateFor(30))
                        .resolver((parent, args, ctx) ->
                                List.copyOf(posts.values())))
                .field(FieldDefinition.newField("echo", "String")
                        .argument("input", "PostInput")
                        .argument(ArgumentDefinition.of("times", "Int", "1"))
                        .resolver((parent, args, ctx) ->
                                String.valueOf(args.get("input")).repeat(
                                        (Integer) args.get("times"))))
                .field(FieldDefinition.newField("price", "Decimal")
                        .staticValue(new BigDecimal("10.50")))
                .field("fail", "String", (parent, args, ctx) -> {
                    throw new IllegalStateException("boom");
                })
                .field("failAsync", "String", (parent, args, ctx) ->
                        CompletableFuture.failedFuture(
                                new IllegalStateException("async boom")))
                .field("slow", "String", (parent, args, ctx) -> {
                    slowStarted.countDown();
                    return new CompletableFuture<String>();
                })
                .field("hello", "String!", (parent, args, ctx) -> "world")
                .build();

        final ObjectType mutation = ObjectType.newObject("Mutation")
                .field(FieldDefinition.newField("increment", "Int!")
                        .argument(ArgumentDefinition.of("by", "Int", "1"))
                        .resolver((parent, args, ctx) -> {
                            mutationLog.add("increment");
                            return counter.addAndGet((Integer) args.get("by"));
                        }))
                .field(FieldDefinition.newField("slowAppend", "String!")
                        .argument("value", "String!")
                        .resolver((parent, args, ctx) -> {
                            Thread.sleep(50);
                            mutationLog.add("slowAppend:" + args.get("value"));
                            return args.get("value");
                        }))
                .field(FieldDefinition.newField("append", "String!")
                        .argument("value", "String!")
                        .resolver((parent, args, ctx) -> {
                            mutationLog.add("append:" + args.get("value"));
                            return args.get("value");
                        }))
                .build();

        return Schema.newSchema()
                .query(query)
                .mutation(mutation)
                .types(node, user, post, postInput,
                        UnionType.of("SearchResult", "User", "Post"),
                        EnumType.of("Role", Role.class),
                        Scalars.DECIMAL)
                .build();
    }
}
