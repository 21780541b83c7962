package com.codeheadsystems.tessera.cli;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * The type Tessera cli test.
 */
class TesseraCliTest {

  private static final String PASSPHRASE = "correct horse battery staple";

  @TempDir
  Path home;

  private ByteArrayOutputStream out;
  private ByteArrayOutputStream err;

  @BeforeEach
  void setUp() {
    out = new ByteArrayOutputStream();
    err = new ByteArrayOutputStream();
  }

  private int run(final Map<String, String> env, final String... args) {
    return new TesseraCli(new PrintStream(out, true, StandardCharsets.UTF_8),
        new PrintStream(err, true, StandardCharsets.UTF_8), env).run(args);
  }

  private int run(final String... args) {
    String[] withState = new String[args.length + 4];
    System.arraycopy(args, 0, withState, 0, args.length);
    withState[args.length] = "--home";
    withState[args.length + 1] = home.toString();
    withState[args.length + 2] = "--passphrase";
    withState[args.length + 3] = PASSPHRASE;
    return run(Map.of(), withState);
  }

  private String stdout() {
    return out.toString(StandardCharsets.UTF_8);
  }

  private String stderr() {
    return err.toString(StandardCharsets.UTF_8);
  }

  @Test
  void noArguments_printsUsage() {
    assertThat(run(Map.of())).isEqualTo(TesseraCli.EXIT_ERROR);
    assertThat(stderr()).contains("Usage:").contains("enroll <server>");
  }

  @Test
  void unknownCommand() {
    assertThat(run("frobnicate")).isEqualTo(TesseraCli.EXIT_ERROR);
    assertThat(stderr()).contains("Unknown command: frobnicate");
  }

  @Test
  void optionWithoutValue() {
    assertThat(run(Map.of(), "status", "--home")).isEqualTo(TesseraCli.EXIT_ERROR);
    assertThat(stderr()).contains("Missing value for option --home");
  }

  @Test
  void missingPassphrase() {
    assertThat(run(Map.of(), "status", "--home", home.toString())).isEqualTo(TesseraCli.EXIT_ERROR);
    assertThat(stderr()).contains(TesseraCli.PASSPHRASE_ENV);
  }

  @Test
  void passphraseFromEnvironment() {
    int exit = run(Map.of(TesseraCli.PASSPHRASE_ENV, PASSPHRASE), "status", "--home", home.toString());

    assertThat(exit).isEqualTo(TesseraCli.EXIT_OK);
    assertThat(stdout()).contains("Not registered.");
  }

  @Test
  void status_freshHome() {
    assertThat(run("status")).isEqualTo(TesseraCli.EXIT_OK);
    assertThat(stdout())
        .contains("Not registered.")
        .contains("Key present: false")
        .contains("Logged in  : false");
  }

  @Test
  void commandMissingArgument() {
    assertThat(run("enroll")).isEqualTo(TesseraCli.EXIT_ERROR);
    assertThat(stderr()).contains("Command 'enroll' needs an argument.");
  }

  @Test
  void probe_invalidServerUrl() {
    assertThat(run("probe", "ftp://example.org")).isEqualTo(TesseraCli.EXIT_ERROR);
    assertThat(stderr()).contains("Rejected:");
  }

  @Test
  void enroll_printsEnrollmentUrl() {
    assertThat(run("enroll", "https://auth.example.org/")).isEqualTo(TesseraCli.EXIT_OK);
    assertThat(stdout())
        .contains("https://auth.example.org/api/auth/enrollDevice?")
        .contains("redirectUri=tessera%3A%2F%2Foauth")
        .contains("state=");
  }

  @Test
  void callback_withForeignState_isASecurityRejection() {
    assertThat(run("enroll", "https://auth.example.org")).isEqualTo(TesseraCli.EXIT_OK);

    int exit = run("callback", "tessera://oauth?iat=eyJ.x.y&state=not-the-one-we-sent");

    assertThat(exit).isEqualTo(TesseraCli.EXIT_SECURITY);
  }

  @Test
  void callback_withoutPendingLogin_isASecurityRejection() {
    assertThat(run("callback", "tessera://oauth?code=abc&state=xyz")).isEqualTo(TesseraCli.EXIT_SECURITY);
  }

  @Test
  void callback_errorFromServer() {
    int exit = run("callback", "tessera://oauth?error=access_denied&error_description=User%20declined");

    assertThat(exit).isEqualTo(TesseraCli.EXIT_ERROR);
    assertThat(stderr()).contains("User declined");
  }

  @Test
  void login_requiresRegistration() {
    assertThat(run("login")).isEqualTo(TesseraCli.EXIT_ERROR);
    assertThat(stderr()).contains("device is not registered");
  }

  @Test
  void logoutAndReset_onFreshHome() {
    assertThat(run("logout")).isEqualTo(TesseraCli.EXIT_OK);
    assertThat(run("reset")).isEqualTo(TesseraCli.EXIT_OK);
    assertThat(stdout()).contains("Logged out").contains("Registration removed.");
  }

  @Test
  void wrongPassphrase_afterStateWasWritten() {
    assertThat(run("enroll", "https://auth.example.org")).isEqualTo(TesseraCli.EXIT_OK);

    int exit = run(Map.of(), "callback", "tessera://oauth?iat=eyJ.x.y&state=s",
        "--home", home.toString(), "--passphrase", "something else");

    assertThat(exit).isEqualTo(TesseraCli.EXIT_ERROR);
    assertThat(stderr()).contains("run 'reset'");
  }
}
