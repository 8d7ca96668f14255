class Greeter {
    void greet(_hole_ x) {
        System.out.println(x);
    }
}
