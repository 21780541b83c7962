package com.codeheadsystems.tessera.client.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.tessera.client.model.ApiResult.ValidationError.Kind;
import java.io.IOException;
import org.junit.jupiter.api.Test;

class ApiResultTest {

  private static final ApiResult.Cases<Object, String> NAMES = new ApiResult.Cases<>() {
    @Override
    public String success(final Object value) {
      return "success:" + value;
    }

    @Override
    public String protocolError(final ApiResult.ProtocolError<?> error) {
      return "protocol:" + error.httpStatus();
    }

    @Override
    public String transportError(final ApiResult.TransportError<?> error) {
      return "transport:" + error.message();
    }

    @Override
    public String validationError(final ApiResult.ValidationError<?> error) {
      return "validation:" + error.kind();
    }
  };

  @Test
  void fold_dispatchesEachVariant() {
    assertThat(ApiResult.<Object>success("v").fold(NAMES)).isEqualTo("success:v");
    assertThat(ApiResult.protocolError("nope", 403).fold(NAMES)).isEqualTo("protocol:403");
    assertThat(ApiResult.transportError(new IOException("down")).fold(NAMES)).isEqualTo("transport:down");
    assertThat(ApiResult.validationError(Kind.INVALID_IAT, "x").fold(NAMES)).isEqualTo("validation:INVALID_IAT");
  }

  @Test
  void map_transformsSuccessOnly() {
    assertThat(ApiResult.success(2).map(i -> i * 21)).isEqualTo(ApiResult.success(42));
    assertThat(ApiResult.<Integer>protocolError("x", 500).map(i -> i * 21))
        .isEqualTo(ApiResult.protocolError("x", 500));
  }

  @Test
  void flatMap_shortCircuitsFailures() {
    ApiResult<String> failure = ApiResult.validationError(Kind.MISSING_PREREQUISITE, "none");

    ApiResult<Integer> result = failure.flatMap(s -> ApiResult.success(s.length()));

    assertThat(result).isEqualTo(ApiResult.validationError(Kind.MISSING_PREREQUISITE, "none"));
    assertThat(result.isSuccess()).isFalse();
    assertThat(result.toOptional()).isEmpty();
  }

  @Test
  void asFailure_onSuccess_throws() {
    assertThatThrownBy(() -> ApiResult.success("v").asFailure()).isInstanceOf(IllegalStateException.class);
  }

  @Test
  void validationError_fatalOnlyForStoreKinds() {
    assertThat(new ApiResult.ValidationError<Void>(Kind.KEY_STORE, "x").fatal()).isTrue();
    assertThat(new ApiResult.ValidationError<Void>(Kind.CREDENTIAL_STORE, "x").fatal()).isTrue();
    assertThat(new ApiResult.ValidationError<Void>(Kind.STATE_MISMATCH, "x").fatal()).isFalse();
    assertThat(new ApiResult.ValidationError<Void>(Kind.INVALID_IAT, "x").fatal()).isFalse();
  }
}
