package io.scenariomodel.cli;

import io.scenariomodel.Main;
import io.scenariomodel.output.Console;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

/**
 * Runs the command line in-process and captures what it prints.
 */
class CliTestSupport {

    static final String LOGIN = """
            Feature: User Login

              Background:
                Given I am on the login page

              @smoke @login
              Scenario: Successful login with valid credentials
                When I enter valid credentials
                Then I should be redirected to the home page

              @smoke @login
              Scenario: Login fails with locked out user
                When I enter locked out user credentials
                Then I should see an error message "Epic sadface: Sorry, this user has been locked out."

              @login @regression
              Scenario Outline: Login with different user types
                When I login with "<username>" and "<password>"
                Then the login result should be "<result>"

                Examples:
                  | username        | password     | result     |
                  | standard_user   | secret_sauce | success    |
                  | locked_out_user | secret_sauce | locked_out |
            """;

    static final String CART = """
            Feature: Shopping Cart

              @smoke @cart
              Scenario: Add a single product to the cart
                When I add "Sauce Labs Backpack" to the cart
                Then the cart badge should show "1"
            """;

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();

    CliTestSupport() {
        Console.setColorsEnabled(false);
        Console.setOutput(new PrintStream(buffer, true, StandardCharsets.UTF_8));
    }

    int run(String... args) {
        buffer.reset();
        return Main.execute(args);
    }

    String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    void close() {
        Console.setOutput(System.out);
    }

}
