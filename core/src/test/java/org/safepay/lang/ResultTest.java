package org.safepay.lang;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.safepay.lang.utils.Causes;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResultTest {
    private static final Cause FIRST = () -> "first";
    private static final Cause SECOND = () -> "second";
    private static final Cause THIRD = () -> "third";

    @Nested
    class Transformations {
        @Test
        void map_transformsSuccessValue() {
            Result.success(21)
                  .map(value -> value * 2)
                  .onFailureRun(Assertions::fail)
                  .onSuccess(value -> assertThat(value).isEqualTo(42));
        }

        @Test
        void map_passesFailureThrough() {
            var invoked = new AtomicInteger();

            Result.<Integer>failure(FIRST)
                  .map(value -> invoked.incrementAndGet())
                  .onSuccessRun(Assertions::fail)
                  .onFailure(cause -> assertThat(cause).isSameAs(FIRST));

            assertThat(invoked).hasValue(0);
        }

        @Test
        void flatMap_stopsAtFirstFailure() {
            var invoked = new AtomicInteger();

            Result.success("value")
                  .flatMap(value -> FIRST.<String>result())
                  .flatMap(value -> {
                      invoked.incrementAndGet();
                      return Result.success(value);
                  })
                  .onSuccessRun(Assertions::fail)
                  .onFailure(cause -> assertThat(cause).isSameAs(FIRST));

            assertThat(invoked).hasValue(0);
        }

        @Test
        void filter_convertsRejectedValueIntoFailure() {
            Result.success(-1)
                  .filter(Causes.forOneValue("Negative value {}"), value -> value >= 0)
                  .onSuccessRun(Assertions::fail)
                  .onFailure(cause -> assertThat(cause.message()).isEqualTo("Negative value -1"));
        }

        @Test
        void mapError_replacesCauseOfFailure() {
            Result.<String>failure(FIRST)
                  .mapError(cause -> SECOND)
                  .onFailure(cause -> assertThat(cause).isSameAs(SECOND));
        }

        @Test
        void unwrap_throwsForFailure() {
            assertThatThrownBy(() -> FIRST.result().unwrap())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("first");
        }

        @Test
        void lift_convertsExceptionIntoFailure() {
            var result = Result.lift(e -> Causes.cause("Parsing failed: " + e.getMessage()),
                                     () -> Integer.parseInt("abc"));

            assertThat(result.isFailure()).isTrue();
            assertThat(result.causes()).extracting(Cause::message)
                                       .containsExactly("Parsing failed: For input string: \"abc\"");
        }
    }

    @Nested
    class Accumulation {
        @Test
        void all_combinesValuesWhenAllSucceed() {
            Result.all(Result.success(1), Result.success("two"), Result.success(3L))
                  .map((first, second, third) -> first + second + third)
                  .onFailureRun(Assertions::fail)
                  .onSuccess(value -> assertThat(value).isEqualTo("1two3"));
        }

        @Test
        void all_reportsEveryFailureInArgumentOrder() {
            Result.all(FIRST.<Integer>result(), Result.success(2), SECOND.<Integer>result(), THIRD.<Integer>result())
                  .map((a, b, c, d) -> a + b + c + d)
                  .onSuccessRun(Assertions::fail)
                  .onFailure(cause -> assertThat(cause.causes()).containsExactly(FIRST, SECOND, THIRD));
        }

        @Test
        void all_neverInvokesMapperWhenAnyStepFails() {
            var invoked = new AtomicInteger();

            Result.all(Result.success(1), FIRST.<Integer>result())
                  .map((a, b) -> invoked.incrementAndGet());

            assertThat(invoked).hasValue(0);
        }

        @Test
        void all_flattensAlreadyAccumulatedFailures() {
            var accumulated = Causes.composite(List.of(FIRST, SECOND)).<String>result();

            Result.all(accumulated, THIRD.<String>result())
                  .map((a, b) -> a + b)
                  .onFailure(cause -> assertThat(cause.causes()).containsExactly(FIRST, SECOND, THIRD));
        }

        @Test
        void all_supportsSixSteps() {
            Result.all(Result.success(1),
                       Result.success(2),
                       Result.success(3),
                       Result.success(4),
                       Result.success(5),
                       Result.success(6))
                  .map((a, b, c, d, e, f) -> a + b + c + d + e + f)
                  .onFailureRun(Assertions::fail)
                  .onSuccess(sum -> assertThat(sum).isEqualTo(21));
        }

        @Test
        void allOf_collectsValuesInOrder() {
            var results = new ArrayList<Result<Integer>>();
            results.add(Result.success(3));
            results.add(Result.success(1));
            results.add(Result.success(2));

            Result.allOf(results)
                  .onFailureRun(Assertions::fail)
                  .onSuccess(values -> assertThat(values).containsExactly(3, 1, 2));
        }

        @Test
        void allOf_reportsAllFailedElements() {
            var results = List.of(FIRST.<Integer>result(), Result.success(1), SECOND.<Integer>result());

            assertThat(Result.allOf(results).causes()).containsExactly(FIRST, SECOND);
        }

        @Test
        void causes_isEmptyForSuccess() {
            assertThat(Result.success("ok").causes()).isEmpty();
        }
    }
}
