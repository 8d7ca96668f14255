class Members {
    void run() {
        Person x = make();
        System.out.println(x.name);
        g(-x.age);
        h(x[0]);
        if (k(x.id)) {
        }
    }
}
