class Greeter {
    void greet(any x) {
        System.out.println(x);
    }
}
