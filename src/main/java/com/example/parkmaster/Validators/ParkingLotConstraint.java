package com.example.parkmaster.Validators;

import jakarta.validation.Constraint;
import jakarta.validation.Payload;
import java.lang.annotation.*;

@Documented
@Constraint(validatedBy = ParkingLotValidator.class)
@Target({ElementType.TYPE})
@Retention(RetentionPolicy.RUNTIME)
public @interface ParkingLotConstraint {
    String message() default "Invalid parking lot layout";
    Class<?>[] groups() default {};
    Class<? extends Payload>[] payload() default {};
}
