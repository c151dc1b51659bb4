package org.croniq.errors;

/**
 * The requested entity does not exist or belongs to another account.
 * The two cases are deliberately indistinguishable to callers.
 */
public class NotFoundException extends RuntimeException {

    public NotFoundException(String message) {
        super(message);
    }
}
