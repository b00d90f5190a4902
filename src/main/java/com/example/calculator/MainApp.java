package com.example.calculator;

/**
 * Console demo of the {@link Calculator} operations.
 */
public class MainApp {
    public static void main(String[] args) {
        Calculator calc = new Calculator();

        System.out.println("=== Calculator Demo ===");
        System.out.println("2 + 3 = " + calc.add(2, 3));
        System.out.println("10 - 4 = " + calc.subtract(10, 4));
        System.out.println("5 * 6 = " + calc.multiply(5, 6));
        System.out.println("5 / 2 = " + calc.divide(5, 2));
        System.out.println("2^-2 = " + calc.power(2, -2));
        System.out.println("sqrt(16) = " + calc.sqrt(16));
        System.out.println("6! = " + calc.factorial(6));
        System.out.println("Is 29 prime? " + calc.isPrime(29));
        System.out.println("gcd(-8, 12) = " + calc.gcd(-8, 12));

        try {
            calc.divide(1, 0);
        } catch (IllegalArgumentException e) {
            System.out.println("1 / 0 rejected: " + e.getMessage());
        }

        System.out.println("\nDemo completed successfully!");
    }
}
