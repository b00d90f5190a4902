package com.example.calculator;

/**
 * Stateless calculator providing basic arithmetic and number-theory operations.
 * Instances hold no state and may be shared between threads.
 */
public class Calculator {

    public int add(int a, int b) {
        return a + b;
    }

    public int subtract(int a, int b) {
        return a - b;
    }

    public int multiply(int a, int b) {
        return a * b;
    }

    /**
     * Divides {@code a} by {@code b} in floating point.
     *
     * @throws IllegalArgumentException if {@code b} is zero
     */
    public double divide(int a, int b) {
        if (b == 0) {
            throw new IllegalArgumentException("Division by zero is not allowed");
        }
        return (double) a / b;
    }

    public double power(double base, double exponent) {
        return Math.pow(base, exponent);
    }

    /**
     * @throws IllegalArgumentException if {@code value} is negative
     */
    public double sqrt(double value) {
        if (value < 0) {
            throw new IllegalArgumentException("Cannot calculate square root of negative number");
        }
        return Math.sqrt(value);
    }

    /**
     * Computes {@code n!} as a 64-bit value. Results for {@code n > 20} do not
     * fit in a {@code long} and wrap around silently.
     *
     * @throws IllegalArgumentException if {@code n} is negative
     */
    public long factorial(int n) {
        if (n < 0) {
            throw new IllegalArgumentException("Factorial is not defined for negative numbers");
        }
        long result = 1L;
        for (int i = 2; i <= n; i++) {
            result *= i;
        }
        return result;
    }

    /**
     * Trial division by 2 and 3, then by candidates of the form 6k-1 and 6k+1
     * up to the square root of {@code n}.
     */
    public boolean isPrime(int n) {
        if (n <= 1) {
            return false;
        }
        if (n <= 3) {
            return true;
        }
        if (n % 2 == 0 || n % 3 == 0) {
            return false;
        }
        // long avoids i * i overflowing for n near Integer.MAX_VALUE
        for (long i = 5; i * i <= n; i += 6) {
            if (n % i == 0 || n % (i + 2) == 0) {
                return false;
            }
        }
        return true;
    }

    /**
     * Greatest common divisor using the Euclidean algorithm on absolute values.
     * {@code gcd(x, 0)} and {@code gcd(0, x)} are both {@code |x|}.
     */
    public int gcd(int a, int b) {
        int x = Math.abs(a);
        int y = Math.abs(b);
        while (y != 0) {
            int remainder = x % y;
            x = y;
            y = remainder;
        }
        return x;
    }
}
