class Greeter {
    // x is what gets printed
    void greet(String x) {
        System.out.println(x);
    }
}
