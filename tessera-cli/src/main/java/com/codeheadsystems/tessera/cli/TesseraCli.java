package com.codeheadsystems.tessera.cli;

import com.codeheadsystems.tessera.client.accessor.OAuthServerAccessor;
import com.codeheadsystems.tessera.client.config.DeviceClientConfig;
import com.codeheadsystems.tessera.client.crypto.AssertionSigner;
import com.codeheadsystems.tessera.client.crypto.PkceGenerator;
import com.codeheadsystems.tessera.client.crypto.RandomProvider;
import com.codeheadsystems.tessera.client.custody.KeyStoreKeyCustody;
import com.codeheadsystems.tessera.client.exceptions.CredentialStoreException;
import com.codeheadsystems.tessera.client.exceptions.KeyCustodyException;
import com.codeheadsystems.tessera.client.manager.CallbackRouter;
import com.codeheadsystems.tessera.client.manager.RegistrationManager;
import com.codeheadsystems.tessera.client.manager.TokenManager;
import com.codeheadsystems.tessera.client.model.ApiResult;
import com.codeheadsystems.tessera.client.model.ApiResult.ValidationError.Kind;
import com.codeheadsystems.tessera.client.store.EncryptedFileCredentialStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.PrintStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command-line device client: enrolls this machine with an authorization server, logs in
 * with PKCE, and calls the protected user endpoint.
 *
 * <pre>
 * Usage:
 *   java -jar tessera-cli.jar &lt;command&gt; [argument] [options]
 *
 * Commands:
 *   probe &lt;server&gt;        Check that the server answers GET /api/system/info.
 *   enroll &lt;server&gt;       Print the enrollment URL to open in a browser.
 *   callback &lt;url&gt;       Complete enrollment or login from the redirect URL.
 *   login                 Print the authorization URL to open in a browser.
 *   me                    Fetch the current user, refreshing the token if needed.
 *   refresh               Refresh the access token now.
 *   status                Show registration and session state.
 *   logout                Forget the tokens, keep the registration.
 *   reset                 Delete the key and forget everything.
 *
 * Options:
 *   --home &lt;dir&gt;          State directory          (default: ~/.tessera)
 *   --passphrase &lt;p&gt;      Passphrase for the state (default: $TESSERA_PASSPHRASE)
 *   --redirect-uri &lt;uri&gt;  Registered redirect URI  (default: tessera://oauth)
 * </pre>
 *
 * <p>Exit status is 0 on success, 1 on usage or processing errors, and 2 when a callback or
 * initial access token is rejected for security reasons.
 */
public class TesseraCli {

  private static final Logger log = LoggerFactory.getLogger(TesseraCli.class);

  static final int EXIT_OK = 0;
  static final int EXIT_ERROR = 1;
  static final int EXIT_SECURITY = 2;
  static final String PASSPHRASE_ENV = "TESSERA_PASSPHRASE";
  static final String KEY_STORE_FILE = "keys.p12";

  private static final Path DEFAULT_HOME = Paths.get(System.getProperty("user.home"), ".tessera");

  private final PrintStream out;
  private final PrintStream err;
  private final Map<String, String> env;

  TesseraCli(final PrintStream out, final PrintStream err, final Map<String, String> env) {
    this.out = out;
    this.err = err;
    this.env = env;
  }

  /**
   * Main entry point.
   *
   * @param args command-line arguments
   */
  public static void main(String[] args) {
    System.exit(new TesseraCli(System.out, System.err, System.getenv()).run(args));
  }

  int run(final String[] args) {
    Path home = DEFAULT_HOME;
    String passphrase = env.get(PASSPHRASE_ENV);
    String redirectUri = DeviceClientConfig.DEFAULT_REDIRECT_URI;
    List<String> positional = new ArrayList<>();

    try {
      for (int i = 0; i < args.length; i++) {
        switch (args[i]) {
          case "--home"         -> home        = Paths.get(args[++i]);
          case "--passphrase"   -> passphrase  = args[++i];
          case "--redirect-uri" -> redirectUri = args[++i];
          default               -> positional.add(args[i]);
        }
      }
    } catch (ArrayIndexOutOfBoundsException e) {
      err.println("Missing value for option " + args[args.length - 1]);
      printUsage();
      return EXIT_ERROR;
    }

    if (positional.isEmpty()) {
      printUsage();
      return EXIT_ERROR;
    }
    if (passphrase == null || passphrase.isEmpty()) {
      err.println("A passphrase is required: use --passphrase or set " + PASSPHRASE_ENV);
      return EXIT_ERROR;
    }

    String command = positional.get(0);
    String argument = positional.size() > 1 ? positional.get(1) : null;
    log.debug("run(): command={}, home={}", command, home);
    try {
      Device device = Device.open(home, passphrase.toCharArray(),
          DeviceClientConfig.defaults().withRedirectUri(redirectUri));
      return switch (command) {
        case "probe"    -> requireArgument(command, argument) ? runProbe(device, argument) : EXIT_ERROR;
        case "enroll"   -> requireArgument(command, argument) ? runEnroll(device, argument) : EXIT_ERROR;
        case "callback" -> requireArgument(command, argument) ? runCallback(device, argument) : EXIT_ERROR;
        case "login"    -> report(device.tokens().startLogin(), this::printBrowserUrl);
        case "me"       -> report(device.tokens().getUserInfo().join(),
            user -> "User: " + user.username() + " (" + user.displayName() + ")");
        case "refresh"  -> report(device.tokens().refreshAccessToken().join(), ignored -> "Token refreshed.");
        case "status"   -> runStatus(device);
        case "logout"   -> report(device.tokens().logout(), ignored -> "Logged out; registration kept.");
        case "reset"    -> report(device.registration().resetRegistration(), ignored -> "Registration removed.");
        default -> {
          err.println("Unknown command: " + command);
          printUsage();
          yield EXIT_ERROR;
        }
      };
    } catch (KeyCustodyException | CredentialStoreException e) {
      err.println("Unable to open local state in " + home + ": " + e.getMessage());
      return EXIT_ERROR;
    }
  }

  private int runProbe(final Device device, final String server) {
    return report(device.registration().checkServer(server).join(),
        info -> "Server is up, version " + info.version() + (info.revision() == null ? "" : " (" + info.revision() + ")"));
  }

  private int runEnroll(final Device device, final String server) {
    return report(device.registration().startEnrollment(server), this::printBrowserUrl);
  }

  private int runCallback(final Device device, final String url) {
    final URI callback;
    try {
      callback = URI.create(url);
    } catch (IllegalArgumentException e) {
      err.println("Not a valid URL: " + url);
      return EXIT_ERROR;
    }
    return report(device.router().handle(callback).join(), outcome -> switch (outcome) {
      case DEVICE_REGISTERED -> "Device registered as client "
          + device.registration().registration().map(r -> r.clientId()).orElse("?") + ".";
      case LOGGED_IN -> "Logged in.";
    });
  }

  private int runStatus(final Device device) {
    device.registration().registration().ifPresentOrElse(registration -> {
      out.println("Server     : " + registration.serverUrl());
      out.println("Client id  : " + registration.clientId());
      out.println("Key id     : " + registration.keyId());
      out.println("Registered : " + Instant.ofEpochMilli(registration.registeredAtEpochMs()));
    }, () -> out.println("Not registered."));
    out.println("Key present: " + device.registration().isDeviceRegistered());
    out.println("Logged in  : " + device.tokens().isLoggedIn());
    return EXIT_OK;
  }

  private String printBrowserUrl(final String url) {
    return "Open this URL in a browser, then pass the redirect URL to 'callback':\n  " + url;
  }

  private boolean requireArgument(final String command, final String argument) {
    if (argument == null) {
      err.println("Command '" + command + "' needs an argument.");
      printUsage();
      return false;
    }
    return true;
  }

  private <T> int report(final ApiResult<T> result, final Function<T, String> describe) {
    return result.fold(new ApiResult.Cases<T, Integer>() {
      @Override
      public Integer success(final T value) {
        out.println(describe.apply(value));
        return EXIT_OK;
      }

      @Override
      public Integer protocolError(final ApiResult.ProtocolError<?> error) {
        err.println("Server rejected the request"
            + (error.httpStatus() == null ? "" : " (HTTP " + error.httpStatus() + ")") + ": " + error.message());
        return EXIT_ERROR;
      }

      @Override
      public Integer transportError(final ApiResult.TransportError<?> error) {
        err.println("Could not reach the server: " + error.message());
        return EXIT_ERROR;
      }

      @Override
      public Integer validationError(final ApiResult.ValidationError<?> error) {
        err.println("Rejected: " + error.message());
        if (error.fatal()) {
          err.println("Local key or credential storage failed; run 'reset' and enroll again.");
        }
        return error.kind() == Kind.STATE_MISMATCH || error.kind() == Kind.INVALID_IAT
            ? EXIT_SECURITY : EXIT_ERROR;
      }
    });
  }

  private void printUsage() {
    err.println("Usage: TesseraCli <command> [argument] [options]");
    err.println();
    err.println("Commands:");
    err.println("  probe <server>       Check that the server is reachable");
    err.println("  enroll <server>      Print the enrollment URL to open in a browser");
    err.println("  callback <url>       Complete enrollment or login from the redirect URL");
    err.println("  login                Print the authorization URL to open in a browser");
    err.println("  me                   Fetch the current user");
    err.println("  refresh              Refresh the access token");
    err.println("  status               Show registration and session state");
    err.println("  logout               Forget the tokens, keep the registration");
    err.println("  reset                Delete the key and forget everything");
    err.println();
    err.println("Options:");
    err.println("  --home <dir>         State directory           (default: " + DEFAULT_HOME + ")");
    err.println("  --passphrase <p>     Passphrase for the state  (default: $" + PASSPHRASE_ENV + ")");
    err.println("  --redirect-uri <uri> Registered redirect URI   (default: "
        + DeviceClientConfig.DEFAULT_REDIRECT_URI + ")");
  }

  /**
   * The engine wired against on-disk state in one directory.
   */
  private record Device(RegistrationManager registration, TokenManager tokens, CallbackRouter router) {

    static Device open(final Path home, final char[] passphrase, final DeviceClientConfig config) {
      ObjectMapper objectMapper = new ObjectMapper();
      KeyStoreKeyCustody custody = KeyStoreKeyCustody.fileBacked(home.resolve(KEY_STORE_FILE), passphrase);
      EncryptedFileCredentialStore store = new EncryptedFileCredentialStore(home, passphrase, objectMapper);
      HttpClient httpClient = HttpClient.newBuilder()
          .connectTimeout(config.httpTimeout())
          .followRedirects(HttpClient.Redirect.NEVER)
          .build();
      OAuthServerAccessor accessor = new OAuthServerAccessor(httpClient, objectMapper, config);
      PkceGenerator pkceGenerator = new PkceGenerator(new RandomProvider());
      Clock clock = Clock.systemUTC();
      RegistrationManager registration = new RegistrationManager(config, custody, store, accessor,
          pkceGenerator, clock);
      TokenManager tokens = new TokenManager(config, new AssertionSigner(custody), pkceGenerator, store,
          accessor, clock);
      return new Device(registration, tokens, new CallbackRouter(registration, tokens, store));
    }
  }
}
