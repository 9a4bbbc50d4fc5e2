package ai.codenav.testutil;

import static ai.codenav.analyzer.ElementKind.CLASS;
import static ai.codenav.analyzer.ElementKind.INTERFACE;

import ai.codenav.analyzer.ElementKind;
import ai.codenav.analyzer.Language;
import ai.codenav.analyzer.Languages;
import ai.codenav.index.Declaration;
import ai.codenav.index.InMemoryCodeModel;
import java.util.List;

/** Small hand-built code models shared by the resolver and service tests. */
public final class TestModels {
    private TestModels() {}

    /**
     * Java zoo.
     *
     * <pre>
     * java.lang.Object (library)      java.lang.Runnable (library) { run() }
     *   zoo.Animal { speak() }
     *     zoo.Dog implements Runnable { speak(), run() }
     *       zoo.Puppy { speak() }
     *     zoo.Cat { speak() }
     * zoo.Keeper { feed(Animal) calls Animal.speak, walk(Runnable) calls Runnable.run }
     * </pre>
     */
    public static InMemoryCodeModel animals() {
        var b = InMemoryCodeModel.builder();
        var object = b.type("java.lang.Object", CLASS, Languages.JAVA, "jdk/java/lang/Object.java", 1, 100);
        b.library(object);
        var runnable = b.type("java.lang.Runnable", INTERFACE, Languages.JAVA, "jdk/java/lang/Runnable.java", 1, 10);
        b.library(runnable);
        var runnableRun = b.method(runnable, "run", List.of(), "run(): void", 5, 5);

        var animal = b.type("zoo.Animal", CLASS, Languages.JAVA, "src/zoo/Animal.java", 3, 20);
        var animalSpeak = b.method(animal, "speak", List.of(), "speak(): String", 5, 7);
        var dog = b.type("zoo.Dog", CLASS, Languages.JAVA, "src/zoo/Dog.java", 3, 30);
        var dogSpeak = b.method(dog, "speak", List.of(), "speak(): String", 5, 8);
        var dogRun = b.method(dog, "run", List.of(), "run(): void", 10, 14);
        var puppy = b.type("zoo.Puppy", CLASS, Languages.JAVA, "src/zoo/Puppy.java", 3, 12);
        var puppySpeak = b.method(puppy, "speak", List.of(), 5, 8);
        var cat = b.type("zoo.Cat", CLASS, Languages.JAVA, "src/zoo/Cat.java", 3, 15);
        var catSpeak = b.method(cat, "speak", List.of(), 5, 8);

        b.extendsType(animal, object);
        b.extendsType(dog, animal).implementsType(dog, runnable);
        b.extendsType(puppy, dog);
        b.extendsType(cat, animal);
        b.overrides(dogSpeak, animalSpeak)
                .overrides(catSpeak, animalSpeak)
                .overrides(puppySpeak, dogSpeak)
                .overrides(dogRun, runnableRun);

        var keeper = b.type("zoo.Keeper", CLASS, Languages.JAVA, "src/zoo/Keeper.java", 1, 20);
        var feed = b.method(keeper, "feed", List.of("Animal"), 3, 6);
        var walk = b.method(keeper, "walk", List.of("Runnable"), 8, 11);
        b.call(feed, animalSpeak, 4, 16);
        b.call(walk, runnableRun, 9, 13);
        return b.build();
    }

    /** {@code chain.Leaf extends Mid extends Base}, each declaring {@code run()}; {@code chain.Skip} lacks it. */
    public static InMemoryCodeModel overrideChain() {
        var b = InMemoryCodeModel.builder();
        var base = b.type("chain.Base", CLASS, Languages.JAVA, "src/chain/Base.java", 1, 10);
        var baseRun = b.method(base, "run", List.of(), "run(): void", 3, 5);
        var mid = b.type("chain.Mid", CLASS, Languages.JAVA, "src/chain/Mid.java", 1, 10);
        var midRun = b.method(mid, "run", List.of(), "run(): void", 3, 5);
        var leaf = b.type("chain.Leaf", CLASS, Languages.JAVA, "src/chain/Leaf.java", 1, 10);
        var leafRun = b.method(leaf, "run", List.of(), "run(): void", 3, 5);
        b.extendsType(mid, base).extendsType(leaf, mid);
        b.overrides(midRun, baseRun).overrides(leafRun, midRun);

        var skip = b.type("chain.Skip", CLASS, Languages.JAVA, "src/chain/Skip.java", 1, 10);
        var far = b.type("chain.Far", CLASS, Languages.JAVA, "src/chain/Far.java", 1, 10);
        var farRun = b.method(far, "run", List.of(), "run(): void", 3, 5);
        b.extendsType(skip, base).extendsType(far, skip);
        b.overrides(farRun, baseRun);
        return b.build();
    }

    /**
     * {@code app.A.f()} calls {@code app.B.g()}, which calls {@code app.T.target(int)} and an unresolvable
     * {@code log.debug}. {@code app.X.ping()} and {@code app.X.pong()} call each other.
     */
    public static InMemoryCodeModel callChain() {
        var b = InMemoryCodeModel.builder();
        var a = b.type("app.A", CLASS, Languages.JAVA, "src/app/A.java", 1, 10);
        var f = b.method(a, "f", List.of(), 2, 5);
        var bType = b.type("app.B", CLASS, Languages.JAVA, "src/app/B.java", 1, 10);
        var g = b.method(bType, "g", List.of(), 2, 6);
        var t = b.type("app.T", CLASS, Languages.JAVA, "src/app/T.java", 1, 10);
        var target = b.method(t, "target", List.of("int"), 2, 5);
        b.call(f, g, 3, 9);
        b.call(g, target, 3, 9);
        b.unresolvedCall(g, "log.debug", 4);

        var x = b.type("app.X", CLASS, Languages.JAVA, "src/app/X.java", 1, 20);
        var ping = b.method(x, "ping", List.of(), 2, 5);
        var pong = b.method(x, "pong", List.of(), 7, 10);
        b.call(ping, pong, 3, 9);
        b.call(pong, ping, 8, 9);
        return b.build();
    }

    /** {@code hub.Hub.target()} called from {@code count} distinct methods. */
    public static InMemoryCodeModel manyCallers(int count) {
        var b = InMemoryCodeModel.builder();
        var hub = b.type("hub.Hub", CLASS, Languages.JAVA, "src/hub/Hub.java", 1, 5);
        var target = b.method(hub, "target", List.of(), 2, 4);
        var callers = b.type("hub.Callers", CLASS, Languages.JAVA, "src/hub/Callers.java", 1, 1000);
        for (int i = 0; i < count; i++) {
            var caller = b.method(callers, "c" + i, List.of(), 10 * i + 2, 10 * i + 5);
            b.call(caller, target, 10 * i + 3, 9);
        }
        return b.build();
    }

    /** Java types named {@code UserService}, {@code UtilitySvc} and {@code Other}, plus a library {@code UserSvc}. */
    public static InMemoryCodeModel services() {
        var b = InMemoryCodeModel.builder();
        var userService = b.type("svc.UserService", CLASS, Languages.JAVA, "src/svc/UserService.java", 1, 30);
        b.method(userService, "findUser", List.of("String"), 5, 9);
        b.field(userService, "users", 3);
        b.type("svc.UtilitySvc", CLASS, Languages.JAVA, "src/svc/UtilitySvc.java", 1, 10);
        b.type("svc.Other", CLASS, Languages.JAVA, "src/svc/Other.java", 1, 10);
        var lib = b.type("lib.UserSvc", INTERFACE, Languages.JAVA, "lib/UserSvc.java", 1, 10);
        b.library(lib);
        return b.build();
    }

    /**
     * Python shapes module: {@code Shape(object)} with {@code area(self)}, {@code Square(Shape)} overriding it,
     * {@code Color(Enum)}, {@code Drawable(Protocol)} and the module function {@code make_square(size)}.
     */
    public static InMemoryCodeModel pythonShapes() {
        var b = InMemoryCodeModel.builder();
        var shape = b.type("shapes.Shape", CLASS, Languages.PYTHON, "shapes.py", 1, 10);
        var shapeArea = b.method(shape, "area", List.of("self"), 3, 4);
        var square = b.type("shapes.Square", CLASS, Languages.PYTHON, "shapes.py", 12, 20);
        var squareArea = b.method(square, "area", List.of("self"), 16, 17);
        var color = b.type("shapes.Color", CLASS, Languages.PYTHON, "shapes.py", 22, 25);
        var drawable = b.type("shapes.Drawable", CLASS, Languages.PYTHON, "shapes.py", 27, 29);
        var makeSquare = b.function("shapes.make_square", Languages.PYTHON, "shapes.py", List.of("size"), 31, 33);
        b.extendsUnresolved(shape, "object");
        b.extendsType(square, shape);
        b.extendsUnresolved(color, "Enum");
        b.extendsUnresolved(drawable, "Protocol");
        b.call(makeSquare, squareArea, 32, 12);
        b.variable("shapes.DEFAULT_SIZE", Languages.PYTHON, "shapes.py", 35);
        return b.build();
    }

    /**
     * JavaScript base class with a TypeScript subclass: {@code Widget.render()} in widget.js, {@code Button extends
     * Widget} overriding {@code render()} in button.ts, without an explicit override fact.
     */
    public static InMemoryCodeModel widgets() {
        var b = InMemoryCodeModel.builder();
        var widget = b.type("widget.Widget", CLASS, Languages.JAVASCRIPT, "src/widget.js", 1, 10);
        b.method(widget, "render", List.of(), 3, 5);
        var button = b.type("button.Button", CLASS, Languages.TYPESCRIPT, "src/button.ts", 1, 12);
        b.method(button, "render", List.of(), 4, 6);
        b.extendsType(button, widget);
        b.extendsUnresolved(widget, "Object");
        return b.build();
    }

    /** A model whose only language is Go, which no built-in family supports. */
    public static InMemoryCodeModel unsupportedLanguage() {
        var b = InMemoryCodeModel.builder();
        var go = new Language("Go", "Go", List.of("go"), null);
        b.declare(new Declaration(
                "main.Server",
                "Server",
                "main.Server",
                ElementKind.STRUCT,
                go,
                "server.go",
                1,
                10,
                null,
                List.of(),
                null,
                false));
        return b.build();
    }
}
